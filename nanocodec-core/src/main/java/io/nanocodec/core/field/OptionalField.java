// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.BoolEncoding;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import java.util.Objects;
import java.util.Optional;

/**
 * Presence byte followed by the inner encoding when present.
 *
 * <pre>
 * empty   -&gt; 00
 * present -&gt; 01 || inner
 * </pre>
 *
 * @param <T> the inner value type
 */
public final class OptionalField<T> implements NcField<Optional<T>> {
    private final NcField<T> inner;
    private final NcType type;

    public OptionalField(final NcField<T> inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.type = new NcType.Optional(inner.type());
    }

    public NcField<T> inner() {
        return inner;
    }

    @Override
    public NcType type() {
        return type;
    }

    @Override
    public String fieldType() {
        return "Optional";
    }

    @Override
    public Optional<T> cast(final Object value) {
        final Optional<?> optional = UserValues.requireClass(value, Optional.class, type.typeName());
        return optional.map(inner::cast);
    }

    @Override
    public byte[] encode(final Optional<T> value) {
        if (value.isEmpty()) {
            return BoolEncoding.encode(false);
        }
        final byte[] payload = inner.encode(value.get());
        final byte[] out = new byte[1 + payload.length];
        out[0] = 1;
        System.arraycopy(payload, 0, out, 1, payload.length);
        return out;
    }

    @Override
    public BufferExtract<Optional<T>> decode(final byte[] buf, final int offset) {
        if (offset >= buf.length) {
            throw DecodingException.noData();
        }
        final int tag = buf[offset] & 0xFF;
        if (tag == 0) {
            return new BufferExtract<>(Optional.empty(), 1);
        }
        if (tag != 1) {
            throw DecodingException.invalidTag("Optional", tag);
        }
        final BufferExtract<T> parsed = inner.decode(buf, offset + 1);
        return new BufferExtract<>(Optional.of(parsed.value()), 1 + parsed.bytesRead());
    }

    @Override
    public JsonNode toUser(final Optional<T> value) {
        return value.map(inner::toUser).orElseGet(UserValues.NODES::nullNode);
    }

    @Override
    public Optional<T> fromUser(final JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(inner.fromUser(data));
    }
}
