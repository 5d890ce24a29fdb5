// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for the codec, gated by {@link CodecDebug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.nanocodec.debug");

    private DebugLogger() {
    }

    public static void logParse(final String message, final Object... args) {
        if (!CodecDebug.isParseLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logCodec(final String message, final Object... args) {
        if (!CodecDebug.isCodecLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Always sanitizes before handing the line to SLF4J.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
