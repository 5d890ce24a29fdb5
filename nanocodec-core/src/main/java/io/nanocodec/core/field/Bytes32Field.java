// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.CodecLimits;
import io.nanocodec.core.encoding.SizedBytes;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.core.types.HexData;
import java.util.EnumSet;
import java.util.Set;

/**
 * Raw 32-byte identifier without prefix. Serves {@code ContractId}, {@code BlueprintId} and
 * {@code VertexId}.
 */
public final class Bytes32Field implements NcField<HexData> {
    private static final Set<LeafType> SUPPORTED =
            EnumSet.of(LeafType.CONTRACT_ID, LeafType.BLUEPRINT_ID, LeafType.VERTEX_ID);

    private final NcType type;

    public Bytes32Field(final LeafType leaf) {
        if (!SUPPORTED.contains(leaf)) {
            throw new IllegalArgumentException("Bytes32Field cannot encode " + leaf.typeName());
        }
        this.type = new NcType.Simple(leaf);
    }

    @Override
    public NcType type() {
        return type;
    }

    @Override
    public String fieldType() {
        return "bytes32";
    }

    @Override
    public HexData cast(final Object value) {
        return UserValues.requireClass(value, HexData.class, type.typeName());
    }

    @Override
    public byte[] encode(final HexData value) {
        return SizedBytes.encode(CodecLimits.HASH_BYTES, value.toBytes());
    }

    @Override
    public BufferExtract<HexData> decode(final byte[] buf, final int offset) {
        final BufferExtract<byte[]> raw = SizedBytes.decode(CodecLimits.HASH_BYTES, buf, offset);
        return new BufferExtract<>(HexData.fromBytes(raw.value()), raw.bytesRead());
    }

    @Override
    public JsonNode toUser(final HexData value) {
        return UserValues.text(value.value());
    }

    @Override
    public HexData fromUser(final JsonNode data) {
        return UserValues.requireHex(data, type.typeName(), CodecLimits.HASH_BYTES);
    }
}
