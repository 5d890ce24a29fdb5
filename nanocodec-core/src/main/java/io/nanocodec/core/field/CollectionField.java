// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.nanocodec.core.encoding.Leb128;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.CollectionKind;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Homogeneous collection: unsigned LEB128 element count, then each element's encoding.
 *
 * <p>
 * {@code list} and {@code deque} decode to an unmodifiable {@link List}; {@code set} and
 * {@code frozenset} decode to an unmodifiable insertion-ordered {@link Set} and reject
 * duplicate elements in both directions. The byte layout is the same for all four.
 *
 * @param <T> the element type
 */
public final class CollectionField<T> implements NcField<Collection<T>> {
    private final CollectionKind kind;
    private final NcField<T> element;
    private final NcType type;

    public CollectionField(final CollectionKind kind, final NcField<T> element) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.element = Objects.requireNonNull(element, "element");
        this.type = new NcType.Collection(kind, element.type());
    }

    public CollectionKind kind() {
        return kind;
    }

    public NcField<T> element() {
        return element;
    }

    @Override
    public NcType type() {
        return type;
    }

    @Override
    public String fieldType() {
        return "Collection";
    }

    @Override
    public Collection<T> cast(final Object value) {
        final Collection<?> raw = UserValues.requireClass(value, Collection.class, type.typeName());
        final List<T> items = new ArrayList<>(raw.size());
        for (Object item : raw) {
            items.add(element.cast(item));
        }
        return freeze(items, false);
    }

    @Override
    public byte[] encode(final Collection<T> value) {
        if (kind.isUnique() && new LinkedHashSet<>(value).size() != value.size()) {
            throw EncodingException.invalidValue(type.typeName() + " cannot hold duplicate elements");
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(Leb128.encodeUnsigned(value.size()));
        for (T item : value) {
            out.writeBytes(element.encode(item));
        }
        return out.toByteArray();
    }

    @Override
    public BufferExtract<Collection<T>> decode(final byte[] buf, final int offset) {
        final BufferExtract<BigInteger> count = Leb128.decodeUnsigned(buf, offset);
        int read = count.bytesRead();
        final int size = checkedCount(count.value(), buf.length - offset - read);
        final List<T> items = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            final BufferExtract<T> parsed = element.decode(buf, offset + read);
            items.add(parsed.value());
            read += parsed.bytesRead();
        }
        return new BufferExtract<>(freeze(items, true), read);
    }

    @Override
    public JsonNode toUser(final Collection<T> value) {
        final ArrayNode array = UserValues.NODES.arrayNode();
        for (T item : value) {
            array.add(element.toUser(item));
        }
        return array;
    }

    @Override
    public Collection<T> fromUser(final JsonNode data) {
        if (data == null || !data.isArray()) {
            throw EncodingException.unexpectedShape(type.typeName(), data);
        }
        final List<T> items = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            items.add(element.fromUser(item));
        }
        return freeze(items, false);
    }

    /**
     * Every element occupies at least one byte, so a count above the remaining length is malformed.
     */
    static int checkedCount(final BigInteger count, final int remaining) {
        if (count.compareTo(BigInteger.valueOf(Math.max(remaining, 0))) > 0) {
            throw DecodingException.lengthExceedsBuffer(count.min(BigInteger.valueOf(Long.MAX_VALUE)).longValue(), remaining);
        }
        return count.intValueExact();
    }

    private Collection<T> freeze(final List<T> items, final boolean decoding) {
        if (!kind.isUnique()) {
            return Collections.unmodifiableList(items);
        }
        final Set<T> set = new LinkedHashSet<>();
        for (T item : items) {
            if (!set.add(item)) {
                if (decoding) {
                    throw DecodingException.duplicate(kind.typeName(), item);
                }
                throw EncodingException.invalidValue("Duplicate %s entry: %s".formatted(kind.typeName(), item));
            }
        }
        return Collections.unmodifiableSet(set);
    }
}
