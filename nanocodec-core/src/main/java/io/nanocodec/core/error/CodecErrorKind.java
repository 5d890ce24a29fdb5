// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.error;

/**
 * Classifies every failure raised by the codec so callers can branch without parsing messages.
 */
public enum CodecErrorKind {
    /** A length or LEB128 prefix exceeds its byte budget, the argument limit or the bytes that remain. */
    MALFORMED_LENGTH,
    /** The buffer ended before the value was complete. */
    TRUNCATED,
    /** An unknown discriminator byte: boolean, token or caller tag. */
    INVALID_TAG,
    /** An address checksum does not match its payload. */
    CHECKSUM_MISMATCH,
    /** An address version byte does not belong to the configured network. */
    VERSION_MISMATCH,
    /** Wrong number of components for a tuple, signed envelope or argument list, or a subtype mismatch. */
    ARITY_MISMATCH,
    /** A value is out of range or has the wrong shape for its type. */
    INVALID_VALUE,
    /** A type descriptor does not match the grammar. */
    PARSE_GRAMMAR,
    /** A type descriptor names a type with no codec. */
    UNSUPPORTED_TYPE
}
