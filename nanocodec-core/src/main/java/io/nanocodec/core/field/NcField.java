// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;

/**
 * Codec for one node of a type tree.
 *
 * <p>
 * Fields are immutable and stateless: every call takes its input and returns a fresh value, so
 * one instance may be shared across threads and reused for every element of a container.
 * {@link FieldFactory} is the only place that maps type nodes to implementations.
 *
 * @param <T> the Java value type
 */
public sealed interface NcField<T>
        permits StrField, IntField, AmountField, BoolField, FloatField, BytesField, Bytes32Field,
        AddressField, TimestampField, TokenUidField, CallerIdField, OptionalField, TupleField,
        SignedDataField, CollectionField, DictField {

    /** The type node this field was built for. */
    NcType type();

    /**
     * Codec identifier. Aliased type names share one identifier, e.g. {@code bytes} for both
     * {@code bytes} and {@code TxOutputScript}.
     */
    String fieldType();

    /**
     * Narrows an untyped value to {@code T}.
     *
     * @throws io.nanocodec.core.error.EncodingException if the value has the wrong class
     */
    T cast(Object value);

    byte[] encode(T value);

    /**
     * Decodes one value starting at {@code offset}. The buffer is never modified.
     *
     * @throws io.nanocodec.core.error.DecodingException on malformed or truncated input
     */
    BufferExtract<T> decode(byte[] buf, int offset);

    /** Renders the value in its JSON API form. */
    JsonNode toUser(T value);

    /**
     * Parses the JSON API form. Shape checks run before any domain validation.
     *
     * @throws io.nanocodec.core.error.EncodingException if the input is malformed
     */
    T fromUser(JsonNode data);

    default BufferExtract<T> decode(final byte[] buf) {
        return decode(buf, 0);
    }

    default byte[] encodeObject(final Object value) {
        return encode(cast(value));
    }

    default JsonNode toUserObject(final Object value) {
        return toUser(cast(value));
    }
}
