// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.PrefixedBytes;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;

/**
 * UTF-8 string with an unsigned LEB128 byte-length prefix.
 */
public final class StrField implements NcField<String> {
    private static final NcType TYPE = new NcType.Simple(LeafType.STR);

    @Override
    public NcType type() {
        return TYPE;
    }

    @Override
    public String fieldType() {
        return "str";
    }

    @Override
    public String cast(final Object value) {
        return UserValues.requireClass(value, String.class, fieldType());
    }

    @Override
    public byte[] encode(final String value) {
        return PrefixedBytes.encodeString(value);
    }

    @Override
    public BufferExtract<String> decode(final byte[] buf, final int offset) {
        return PrefixedBytes.decodeString(buf, offset);
    }

    @Override
    public JsonNode toUser(final String value) {
        return UserValues.text(value);
    }

    @Override
    public String fromUser(final JsonNode data) {
        return UserValues.requireText(data, fieldType());
    }
}
