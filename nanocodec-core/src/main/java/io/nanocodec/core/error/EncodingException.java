// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.error;

/**
 * Thrown when a value or a piece of user input cannot be turned into its wire form.
 */
public final class EncodingException extends NanoCodecException {

    public EncodingException(final CodecErrorKind kind, final String message) {
        super(kind, message);
    }

    public EncodingException(final CodecErrorKind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }

    public static EncodingException invalidValue(final String message) {
        return new EncodingException(CodecErrorKind.INVALID_VALUE, message);
    }

    public static EncodingException invalidValue(final String message, final Throwable cause) {
        return new EncodingException(CodecErrorKind.INVALID_VALUE, message, cause);
    }

    /**
     * User input is not of the JSON shape the type expects.
     */
    public static EncodingException unexpectedShape(final String type, final Object input) {
        return new EncodingException(
                CodecErrorKind.INVALID_VALUE, "Invalid input for type '%s': %s".formatted(type, input));
    }

    /**
     * Java value is not of the class the field encodes.
     */
    public static EncodingException wrongValueType(final String type, final Object value) {
        final String actual = value == null ? "null" : value.getClass().getName();
        return new EncodingException(
                CodecErrorKind.INVALID_VALUE, "Cannot encode %s as '%s'".formatted(actual, type));
    }

    public static EncodingException arityMismatch(final String message) {
        return new EncodingException(CodecErrorKind.ARITY_MISMATCH, message);
    }

    /**
     * A signed envelope declares a different inner type than the codec was built for.
     */
    public static EncodingException subtypeMismatch(final String expected, final String actual) {
        return new EncodingException(
                CodecErrorKind.ARITY_MISMATCH, "Expected %s but received %s".formatted(expected, actual));
    }
}
