// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.method;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.nanocodec.core.chain.Network;
import io.nanocodec.core.encoding.CodecLimits;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.field.FieldFactory;
import io.nanocodec.core.field.NcField;
import io.nanocodec.core.field.SignedDataField;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.core.types.HexData;
import io.nanocodec.core.types.SignedData;
import io.nanocodec.primitives.Hex;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * A named, typed argument of a blueprint method call.
 *
 * <p>
 * Signed arguments whose inner type is a leaf also have a flat text form used by older clients:
 *
 * <pre>
 * SignedData[T]    : signature,producerId,value,T
 * RawSignedData[T] : signature,value,T
 * </pre>
 *
 * <p>
 * Signature and producer id are hex. The value may itself contain commas; only the first
 * separators and the last one are significant.
 *
 * @param name  the parameter name
 * @param type  the type descriptor
 * @param value the value, typed as the field for {@code type} expects
 */
public record MethodArgument(String name, String type, Object value) {

    public MethodArgument {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Parses an argument received from an API client.
     *
     * @throws EncodingException if the input does not match the type
     */
    public static MethodArgument fromApiInput(
            final String name, final String type, final JsonNode input, final Network network) {
        final NcField<?> field = FieldFactory.fieldFor(type, network);
        if (field instanceof SignedDataField<?> signed && input != null && input.isTextual()) {
            return new MethodArgument(name, type, parseFlat(signed, type, input.textValue()));
        }
        return new MethodArgument(name, type, field.fromUser(input));
    }

    /**
     * Decodes one argument at {@code offset}.
     */
    public static BufferExtract<MethodArgument> fromSerialized(
            final String name, final String type, final byte[] buf, final int offset, final Network network) {
        final BufferExtract<?> extract = FieldFactory.fieldFor(type, network).decode(buf, offset);
        return new BufferExtract<>(new MethodArgument(name, type, extract.value()), extract.bytesRead());
    }

    public byte[] serialize(final Network network) {
        return FieldFactory.fieldFor(type, network).encodeObject(value);
    }

    /**
     * Renders the argument for an API client. Signed leaf values use the flat text form.
     */
    public ParsedArgument toApiInput(final Network network) {
        final NcField<?> field = FieldFactory.fieldFor(type, network);
        if (field instanceof SignedDataField<?> signed && isLeaf(signed)) {
            return new ParsedArgument(name, type, JsonNodeFactory.instance.textNode(toFlat(signed, value)));
        }
        return new ParsedArgument(name, type, field.toUserObject(value));
    }

    private static <T> SignedData<T> parseFlat(
            final SignedDataField<T> field, final String type, final String text) {
        if (!isLeaf(field)) {
            throw EncodingException.unexpectedShape(type, text);
        }
        final int afterSignature = text.indexOf(',');
        final int beforeType = text.lastIndexOf(',');
        if (afterSignature < 0 || afterSignature == beforeType) {
            throw EncodingException.unexpectedShape(type, text);
        }
        final String signature = text.substring(0, afterSignature);
        int valueStart = afterSignature + 1;
        HexData producerId = null;
        if (field.hasProducer()) {
            final int afterProducer = text.indexOf(',', valueStart);
            if (afterProducer == beforeType) {
                throw EncodingException.unexpectedShape(type, text);
            }
            final String producer = text.substring(valueStart, afterProducer);
            if (!Hex.isHex(producer) || producer.length() != CodecLimits.HASH_BYTES * 2) {
                throw EncodingException.unexpectedShape(type + ".producerId", producer);
            }
            producerId = HexData.of(producer);
            valueStart = afterProducer + 1;
        }
        if (!Hex.isHex(signature)) {
            throw EncodingException.unexpectedShape(type + ".signature", signature);
        }
        final String declared = text.substring(beforeType + 1).trim();
        if (!field.acceptsSubtype(declared) && !declared.equals(type) && !declared.equals(field.type().typeName())) {
            throw EncodingException.subtypeMismatch(field.subtype(), declared);
        }
        final String valueText = text.substring(valueStart, beforeType);
        final T value = field.inner().fromUser(JsonNodeFactory.instance.textNode(valueText));
        return new SignedData<>(field.subtype(), value, HexData.of(signature), producerId);
    }

    private static <T> String toFlat(final SignedDataField<T> field, final Object value) {
        final SignedData<T> envelope = field.cast(value);
        final JsonNode rendered = field.inner().toUser(envelope.value());
        final StringJoiner joiner = new StringJoiner(",");
        joiner.add(envelope.signature().value());
        if (envelope.producerId() != null) {
            joiner.add(envelope.producerId().value());
        }
        joiner.add(rendered.isTextual() ? rendered.textValue() : rendered.toString());
        joiner.add(field.subtype());
        return joiner.toString();
    }

    private static boolean isLeaf(final SignedDataField<?> field) {
        return field.inner().type().kind() == NcType.Kind.SIMPLE;
    }
}
