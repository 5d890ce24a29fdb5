// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nanocodec.core.encoding.CodecLimits;
import io.nanocodec.core.encoding.PrefixedBytes;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.core.types.HexData;
import io.nanocodec.core.types.SignedData;
import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Signed envelope around an inner value. Serves {@code SignedData[T]} and {@code RawSignedData[T]}.
 *
 * <pre>
 * SignedData[T]    : producerId(32) || T || signature(length-prefixed)
 * RawSignedData[T] :                   T || signature(length-prefixed)
 * </pre>
 *
 * <p>
 * The envelope's {@code type} must name the subtype this field was built for, either as written
 * in the descriptor or in normalized form.
 *
 * @param <T> the inner value type
 */
public final class SignedDataField<T> implements NcField<SignedData<T>> {
    private final NcField<T> inner;
    private final String subtype;
    private final boolean withProducer;
    private final NcType type;
    private final Bytes32Field producerField = new Bytes32Field(LeafType.CONTRACT_ID);

    private SignedDataField(final NcField<T> inner, final String subtype, final boolean withProducer) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.subtype = Objects.requireNonNull(subtype, "subtype");
        this.withProducer = withProducer;
        this.type = withProducer
                ? new NcType.SignedData(inner.type(), subtype)
                : new NcType.RawSignedData(inner.type(), subtype);
    }

    /** Envelope carrying the 32-byte id of the producing contract. */
    public static <T> SignedDataField<T> signed(final NcField<T> inner, final String subtype) {
        return new SignedDataField<>(inner, subtype, true);
    }

    /** Envelope without producer id. */
    public static <T> SignedDataField<T> raw(final NcField<T> inner, final String subtype) {
        return new SignedDataField<>(inner, subtype, false);
    }

    public NcField<T> inner() {
        return inner;
    }

    public String subtype() {
        return subtype;
    }

    public boolean hasProducer() {
        return withProducer;
    }

    @Override
    public NcType type() {
        return type;
    }

    @Override
    public String fieldType() {
        return "SignedData";
    }

    @Override
    public SignedData<T> cast(final Object value) {
        final SignedData<?> envelope = UserValues.requireClass(value, SignedData.class, type.typeName());
        return new SignedData<>(envelope.type(), inner.cast(envelope.value()), envelope.signature(), envelope.producerId());
    }

    @Override
    public byte[] encode(final SignedData<T> value) {
        checkSubtype(value.type());
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (withProducer) {
            if (value.producerId() == null) {
                throw EncodingException.invalidValue(type.typeName() + " requires a producerId");
            }
            out.writeBytes(producerField.encode(value.producerId()));
        } else if (value.producerId() != null) {
            throw EncodingException.invalidValue(type.typeName() + " does not carry a producerId");
        }
        out.writeBytes(inner.encode(value.value()));
        out.writeBytes(PrefixedBytes.encode(value.signature().toBytes()));
        return out.toByteArray();
    }

    @Override
    public BufferExtract<SignedData<T>> decode(final byte[] buf, final int offset) {
        int read = 0;
        HexData producerId = null;
        if (withProducer) {
            final BufferExtract<HexData> producer = producerField.decode(buf, offset);
            producerId = producer.value();
            read += producer.bytesRead();
        }
        final BufferExtract<T> value = inner.decode(buf, offset + read);
        read += value.bytesRead();
        final BufferExtract<byte[]> signature = PrefixedBytes.decode(buf, offset + read);
        read += signature.bytesRead();
        return new BufferExtract<>(
                new SignedData<>(subtype, value.value(), HexData.fromBytes(signature.value()), producerId), read);
    }

    @Override
    public JsonNode toUser(final SignedData<T> value) {
        final ObjectNode node = UserValues.NODES.objectNode();
        node.put("type", value.type());
        node.put("signature", value.signature().value());
        node.set("value", inner.toUser(value.value()));
        if (value.producerId() != null) {
            node.put("producerId", value.producerId().value());
        }
        return node;
    }

    @Override
    public SignedData<T> fromUser(final JsonNode data) {
        if (data == null || !data.isObject()) {
            throw EncodingException.unexpectedShape(type.typeName(), data);
        }
        final String declared = UserValues.requireText(data.get("type"), type.typeName() + ".type");
        final HexData signature = UserValues.requireHex(data.get("signature"), type.typeName() + ".signature");
        HexData producerId = null;
        if (withProducer) {
            producerId = UserValues.requireHex(
                    data.get("producerId"), type.typeName() + ".producerId", CodecLimits.HASH_BYTES);
        }
        checkSubtype(declared);
        final JsonNode rawValue = data.has("value") ? data.get("value") : UserValues.NODES.nullNode();
        return new SignedData<>(subtype, inner.fromUser(rawValue), signature, producerId);
    }

    /**
     * Returns {@code true} if {@code declared} names this field's subtype.
     */
    public boolean acceptsSubtype(final String declared) {
        return subtype.equals(declared) || inner.type().typeName().equals(declared);
    }

    private void checkSubtype(final String declared) {
        if (!acceptsSubtype(declared)) {
            throw EncodingException.subtypeMismatch(subtype, declared);
        }
    }
}
