// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.error;

/**
 * Thrown when a type descriptor cannot be parsed or names a type without a codec.
 */
public final class TypeParseException extends NanoCodecException {

    public TypeParseException(final CodecErrorKind kind, final String message) {
        super(kind, message);
    }

    public static TypeParseException invalidSyntax(final String descriptor) {
        return new TypeParseException(CodecErrorKind.PARSE_GRAMMAR, "Unable to parse type: " + descriptor);
    }

    public static TypeParseException wrongArity(final String container, final int expected, final int actual) {
        return new TypeParseException(
                CodecErrorKind.PARSE_GRAMMAR,
                "%s expects %d type arguments but got %d".formatted(container, expected, actual));
    }

    public static TypeParseException tooDeep(final int maxDepth) {
        return new TypeParseException(
                CodecErrorKind.PARSE_GRAMMAR, "Type nesting exceeds the maximum depth of %d".formatted(maxDepth));
    }

    public static TypeParseException unsupportedType(final String name) {
        return new TypeParseException(CodecErrorKind.UNSUPPORTED_TYPE, "Unsupported field type: " + name);
    }
}
