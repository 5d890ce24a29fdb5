// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core;

import java.util.regex.Pattern;

/**
 * Removes sensitive data from debug log payloads.
 *
 * <ul>
 * <li>Redacts signature values of signed envelopes</li>
 * <li>Truncates excessively long lines, such as hex dumps of large arguments</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches {@code "signature":"<hex>"} in JSON renderings. */
    private static final Pattern SIGNATURE_JSON_PATTERN =
            Pattern.compile("\"signature\"\\s*:\\s*\"[^\"]+\"");

    private static final String SIGNATURE_JSON_REPLACEMENT = "\"signature\":\"***[REDACTED]***\"";

    /** Matches {@code signature=HexData[value=<hex>]} in record toString output. */
    private static final Pattern SIGNATURE_FIELD_PATTERN =
            Pattern.compile("signature=(?:HexData\\[value=)?[0-9a-fA-F]*\\]?");

    private static final String SIGNATURE_FIELD_REPLACEMENT = "signature=***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"signature\"")) {
            sanitized = SIGNATURE_JSON_PATTERN.matcher(sanitized).replaceAll(SIGNATURE_JSON_REPLACEMENT);
        }

        if (sanitized.contains("signature=")) {
            sanitized = SIGNATURE_FIELD_PATTERN.matcher(sanitized).replaceAll(SIGNATURE_FIELD_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
