// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core;

/**
 * Global toggle for verbose codec diagnostics.
 *
 * <p>Parse logging reports every descriptor the parser resolves. Codec logging reports each
 * top-level serialize and deserialize call with its sanitized payload. Both flags are volatile.
 */
public final class CodecDebug {

    private static volatile boolean parseLogging = false;
    private static volatile boolean codecLogging = false;

    private CodecDebug() {
    }

    public static boolean isEnabled() {
        return parseLogging || codecLogging;
    }

    public static void setEnabled(final boolean enabled) {
        parseLogging = enabled;
        codecLogging = enabled;
    }

    public static void setParseLogging(final boolean enabled) {
        parseLogging = enabled;
    }

    public static boolean isParseLoggingEnabled() {
        return parseLogging;
    }

    public static void setCodecLogging(final boolean enabled) {
        codecLogging = enabled;
    }

    public static boolean isCodecLoggingEnabled() {
        return codecLogging;
    }
}
