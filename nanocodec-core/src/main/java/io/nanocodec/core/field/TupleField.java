// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-arity heterogeneous sequence: element encodings back to back, no prefix.
 */
public final class TupleField implements NcField<List<Object>> {
    private final List<NcField<?>> elements;
    private final NcType type;

    public TupleField(final List<? extends NcField<?>> elements) {
        this.elements = List.copyOf(elements);
        final List<NcType> types = new ArrayList<>(this.elements.size());
        for (NcField<?> element : this.elements) {
            types.add(element.type());
        }
        this.type = new NcType.Tuple(types);
    }

    public List<NcField<?>> elements() {
        return elements;
    }

    @Override
    public NcType type() {
        return type;
    }

    @Override
    public String fieldType() {
        return "Tuple";
    }

    @Override
    public List<Object> cast(final Object value) {
        final List<?> list = UserValues.requireClass(value, List.class, type.typeName());
        checkArity(list.size());
        final List<Object> out = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            out.add(elements.get(i).cast(list.get(i)));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public byte[] encode(final List<Object> value) {
        checkArity(value.size());
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < elements.size(); i++) {
            out.writeBytes(elements.get(i).encodeObject(value.get(i)));
        }
        return out.toByteArray();
    }

    @Override
    public BufferExtract<List<Object>> decode(final byte[] buf, final int offset) {
        final List<Object> values = new ArrayList<>(elements.size());
        int read = 0;
        for (NcField<?> element : elements) {
            final BufferExtract<?> parsed = element.decode(buf, offset + read);
            values.add(parsed.value());
            read += parsed.bytesRead();
        }
        return new BufferExtract<>(Collections.unmodifiableList(values), read);
    }

    @Override
    public JsonNode toUser(final List<Object> value) {
        checkArity(value.size());
        final ArrayNode array = UserValues.NODES.arrayNode();
        for (int i = 0; i < elements.size(); i++) {
            array.add(elements.get(i).toUserObject(value.get(i)));
        }
        return array;
    }

    @Override
    public List<Object> fromUser(final JsonNode data) {
        if (data == null || !data.isArray()) {
            throw EncodingException.unexpectedShape(type.typeName(), data);
        }
        checkArity(data.size());
        final List<Object> values = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            values.add(elements.get(i).fromUser(data.get(i)));
        }
        return Collections.unmodifiableList(values);
    }

    private void checkArity(final int size) {
        if (size != elements.size()) {
            throw EncodingException.arityMismatch(
                    "Mismatched number of values from type: expected %d, got %d".formatted(elements.size(), size));
        }
    }
}
