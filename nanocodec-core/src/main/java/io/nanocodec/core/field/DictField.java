// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nanocodec.core.encoding.Leb128;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mapping: unsigned LEB128 entry count, then {@code key || value} per entry.
 *
 * <p>
 * Decoded maps keep wire order and reject repeated keys. In the JSON form keys are object
 * member names: the key's user form for leaf keys, the JSON text of it for container keys.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class DictField<K, V> implements NcField<Map<K, V>> {
    private final NcField<K> keyField;
    private final NcField<V> valueField;
    private final NcType type;

    public DictField(final NcField<K> keyField, final NcField<V> valueField) {
        this.keyField = Objects.requireNonNull(keyField, "keyField");
        this.valueField = Objects.requireNonNull(valueField, "valueField");
        this.type = new NcType.Dict(keyField.type(), valueField.type());
    }

    public NcField<K> keyField() {
        return keyField;
    }

    public NcField<V> valueField() {
        return valueField;
    }

    @Override
    public NcType type() {
        return type;
    }

    @Override
    public String fieldType() {
        return "Dict";
    }

    @Override
    public Map<K, V> cast(final Object value) {
        final Map<?, ?> raw = UserValues.requireClass(value, Map.class, type.typeName());
        final Map<K, V> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            out.put(keyField.cast(entry.getKey()), valueField.cast(entry.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public byte[] encode(final Map<K, V> value) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(Leb128.encodeUnsigned(value.size()));
        for (Map.Entry<K, V> entry : value.entrySet()) {
            out.writeBytes(keyField.encode(entry.getKey()));
            out.writeBytes(valueField.encode(entry.getValue()));
        }
        return out.toByteArray();
    }

    @Override
    public BufferExtract<Map<K, V>> decode(final byte[] buf, final int offset) {
        final BufferExtract<BigInteger> count = Leb128.decodeUnsigned(buf, offset);
        int read = count.bytesRead();
        final int size = CollectionField.checkedCount(count.value(), buf.length - offset - read);
        final Map<K, V> entries = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            final BufferExtract<K> key = keyField.decode(buf, offset + read);
            read += key.bytesRead();
            final BufferExtract<V> val = valueField.decode(buf, offset + read);
            read += val.bytesRead();
            if (entries.containsKey(key.value())) {
                throw DecodingException.duplicate("Dict key", key.value());
            }
            entries.put(key.value(), val.value());
        }
        return new BufferExtract<>(Collections.unmodifiableMap(entries), read);
    }

    @Override
    public JsonNode toUser(final Map<K, V> value) {
        final ObjectNode node = UserValues.NODES.objectNode();
        for (Map.Entry<K, V> entry : value.entrySet()) {
            node.set(keyText(keyField.toUser(entry.getKey())), valueField.toUser(entry.getValue()));
        }
        return node;
    }

    @Override
    public Map<K, V> fromUser(final JsonNode data) {
        if (data == null || !data.isObject()) {
            throw EncodingException.unexpectedShape(type.typeName(), data);
        }
        final Map<K, V> entries = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final K key = keyField.fromUser(keyNode(field.getKey()));
            if (entries.containsKey(key)) {
                throw EncodingException.invalidValue("Duplicate Dict key: " + field.getKey());
            }
            entries.put(key, valueField.fromUser(field.getValue()));
        }
        return Collections.unmodifiableMap(entries);
    }

    private String keyText(final JsonNode key) {
        if (keyField.type().kind() == NcType.Kind.SIMPLE && key.isTextual()) {
            return key.textValue();
        }
        return key.toString();
    }

    private JsonNode keyNode(final String text) {
        if (keyField.type().kind() == NcType.Kind.SIMPLE) {
            return UserValues.text(text);
        }
        try {
            return UserValues.MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw EncodingException.invalidValue("Invalid %s key: %s".formatted(type.typeName(), text), e);
        }
    }
}
