// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.PrefixedBytes;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.core.types.HexData;

/**
 * Length-prefixed byte blob. Serves {@code bytes} and {@code TxOutputScript}.
 */
public final class BytesField implements NcField<HexData> {
    private final NcType type;

    public BytesField() {
        this(LeafType.BYTES);
    }

    public BytesField(final LeafType leaf) {
        if (leaf != LeafType.BYTES && leaf != LeafType.TX_OUTPUT_SCRIPT) {
            throw new IllegalArgumentException("BytesField cannot encode " + leaf.typeName());
        }
        this.type = new NcType.Simple(leaf);
    }

    @Override
    public NcType type() {
        return type;
    }

    @Override
    public String fieldType() {
        return "bytes";
    }

    @Override
    public HexData cast(final Object value) {
        return UserValues.requireClass(value, HexData.class, type.typeName());
    }

    @Override
    public byte[] encode(final HexData value) {
        return PrefixedBytes.encode(value.toBytes());
    }

    @Override
    public BufferExtract<HexData> decode(final byte[] buf, final int offset) {
        final BufferExtract<byte[]> raw = PrefixedBytes.decode(buf, offset);
        return new BufferExtract<>(HexData.fromBytes(raw.value()), raw.bytesRead());
    }

    @Override
    public JsonNode toUser(final HexData value) {
        return UserValues.text(value.value());
    }

    @Override
    public HexData fromUser(final JsonNode data) {
        return UserValues.requireHex(data, type.typeName());
    }
}
