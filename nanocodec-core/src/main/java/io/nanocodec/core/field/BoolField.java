// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.BoolEncoding;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;

/**
 * Boolean as one byte; rendered as the strings {@code "true"} and {@code "false"}.
 */
public final class BoolField implements NcField<Boolean> {
    private static final NcType TYPE = new NcType.Simple(LeafType.BOOL);

    @Override
    public NcType type() {
        return TYPE;
    }

    @Override
    public String fieldType() {
        return "bool";
    }

    @Override
    public Boolean cast(final Object value) {
        return UserValues.requireClass(value, Boolean.class, fieldType());
    }

    @Override
    public byte[] encode(final Boolean value) {
        return BoolEncoding.encode(value);
    }

    @Override
    public BufferExtract<Boolean> decode(final byte[] buf, final int offset) {
        return BoolEncoding.decode(buf, offset);
    }

    @Override
    public JsonNode toUser(final Boolean value) {
        return UserValues.text(value ? "true" : "false");
    }

    @Override
    public Boolean fromUser(final JsonNode data) {
        return UserValues.requireBoolean(data, fieldType());
    }
}
