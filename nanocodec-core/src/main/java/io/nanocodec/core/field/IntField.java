// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.Leb128;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import java.math.BigInteger;

/**
 * Arbitrary-precision signed integer as signed LEB128. Serves both {@code int} and {@code VarInt}.
 */
public final class IntField implements NcField<BigInteger> {
    private final NcType type;

    public IntField() {
        this(LeafType.INT);
    }

    public IntField(final LeafType leaf) {
        if (leaf != LeafType.INT && leaf != LeafType.VAR_INT) {
            throw new IllegalArgumentException("IntField cannot encode " + leaf.typeName());
        }
        this.type = new NcType.Simple(leaf);
    }

    @Override
    public NcType type() {
        return type;
    }

    @Override
    public String fieldType() {
        return "int";
    }

    @Override
    public BigInteger cast(final Object value) {
        return UserValues.requireClass(value, BigInteger.class, type.typeName());
    }

    @Override
    public byte[] encode(final BigInteger value) {
        return Leb128.encodeSigned(value);
    }

    @Override
    public BufferExtract<BigInteger> decode(final byte[] buf, final int offset) {
        return Leb128.decodeSigned(buf, offset);
    }

    @Override
    public JsonNode toUser(final BigInteger value) {
        return UserValues.text(value.toString());
    }

    @Override
    public BigInteger fromUser(final JsonNode data) {
        return UserValues.requireInteger(data, type.typeName());
    }
}
