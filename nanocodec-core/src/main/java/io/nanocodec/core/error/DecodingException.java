// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.error;

/**
 * Thrown when a byte buffer cannot be decoded as the requested type.
 */
public final class DecodingException extends NanoCodecException {

    public DecodingException(final CodecErrorKind kind, final String message) {
        super(kind, message);
    }

    public DecodingException(final CodecErrorKind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    public static DecodingException noData() {
        return new DecodingException(CodecErrorKind.TRUNCATED, "No data left to read");
    }

    /**
     * Fewer bytes remain than the value needs.
     */
    public static DecodingException truncated(final String what, final int needed, final int available) {
        return new DecodingException(
                CodecErrorKind.TRUNCATED,
                "Not enough bytes to read %s: need %d, have %d".formatted(what, needed, available));
    }

    /**
     * A LEB128 value used more groups than its budget allows.
     */
    public static DecodingException leb128TooLong(final int maxBytes) {
        return new DecodingException(
                CodecErrorKind.MALFORMED_LENGTH, "LEB128 value exceeds the maximum of %d bytes".formatted(maxBytes));
    }

    /**
     * A length prefix is larger than the argument limit.
     */
    public static DecodingException lengthTooLarge(final long length, final int max) {
        return new DecodingException(
                CodecErrorKind.MALFORMED_LENGTH,
                "Length %d exceeds the maximum of %d bytes".formatted(length, max));
    }

    /**
     * A length prefix claims more bytes than the buffer holds.
     */
    public static DecodingException lengthExceedsBuffer(final long length, final int remaining) {
        return new DecodingException(
                CodecErrorKind.MALFORMED_LENGTH,
                "Declared length %d exceeds the %d bytes remaining".formatted(length, remaining));
    }

    public static DecodingException invalidTag(final String what, final int tag) {
        return new DecodingException(
                CodecErrorKind.INVALID_TAG, "Invalid %s tag: 0x%02x".formatted(what, tag & 0xFF));
    }

    public static DecodingException invalidValue(final String message) {
        return new DecodingException(CodecErrorKind.INVALID_VALUE, message);
    }

    public static DecodingException invalidValue(final String message, final Throwable cause) {
        return new DecodingException(CodecErrorKind.INVALID_VALUE, message, cause);
    }

    /**
     * A set or dict holds the same element twice.
     */
    public static DecodingException duplicate(final String container, final Object element) {
        return new DecodingException(
                CodecErrorKind.INVALID_VALUE, "Duplicate %s entry: %s".formatted(container, element));
    }

    public static DecodingException trailingBytes(final int count) {
        return new DecodingException(
                CodecErrorKind.MALFORMED_LENGTH, "%d unexpected trailing bytes".formatted(count));
    }
}
