// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.types;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A value with a signature over it.
 *
 * <p>
 * {@code producerId} names the contract that produced the value and is present only for the
 * {@code SignedData[T]} form; {@code RawSignedData[T]} envelopes leave it {@code null}.
 *
 * @param type       the inner type descriptor, e.g. {@code "int"}
 * @param value      the signed value, typed as the inner field's Java type
 * @param signature  the signature bytes
 * @param producerId the 32-byte producer id, or {@code null}
 * @param <T>        Java type of the value
 */
public record SignedData<T>(String type, T value, HexData signature, @Nullable HexData producerId) {

    public SignedData {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(signature, "signature");
    }

    public static <T> SignedData<T> raw(final String type, final T value, final HexData signature) {
        return new SignedData<>(type, value, signature, null);
    }

    public static <T> SignedData<T> signed(
            final String type, final T value, final HexData signature, final HexData producerId) {
        return new SignedData<>(type, value, signature, Objects.requireNonNull(producerId, "producerId"));
    }
}
