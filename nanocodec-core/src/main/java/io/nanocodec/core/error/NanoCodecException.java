// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.error;

import java.util.Objects;

/**
 * Base runtime exception for all codec failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * NanoCodecException
 * ├── {@link DecodingException} - malformed wire input
 * ├── {@link EncodingException} - values or user input that cannot be encoded
 * └── {@link TypeParseException} - type descriptors outside the grammar
 * </pre>
 *
 * <p>Each instance carries a {@link CodecErrorKind}. A failed call never yields a partial value.
 *
 * <pre>{@code
 * try {
 *     codec.deserialize(bytes, "Dict[str, Amount]");
 * } catch (DecodingException e) {
 *     if (e.kind() == CodecErrorKind.MALFORMED_LENGTH) {
 *         // reject the request
 *     }
 * }
 * }</pre>
 */
public sealed class NanoCodecException extends RuntimeException
        permits DecodingException, EncodingException, TypeParseException {

    private final CodecErrorKind kind;

    public NanoCodecException(final CodecErrorKind kind, final String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public NanoCodecException(final CodecErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public CodecErrorKind kind() {
        return kind;
    }
}
