// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.FixedNumbers;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;

/**
 * IEEE-754 double, 8 bytes big-endian.
 */
public final class FloatField implements NcField<Double> {
    private static final NcType TYPE = new NcType.Simple(LeafType.FLOAT);

    @Override
    public NcType type() {
        return TYPE;
    }

    @Override
    public String fieldType() {
        return "float";
    }

    @Override
    public Double cast(final Object value) {
        return UserValues.requireClass(value, Double.class, fieldType());
    }

    @Override
    public byte[] encode(final Double value) {
        return FixedNumbers.encodeDouble(value);
    }

    @Override
    public BufferExtract<Double> decode(final byte[] buf, final int offset) {
        return FixedNumbers.decodeDouble(buf, offset);
    }

    @Override
    public JsonNode toUser(final Double value) {
        return UserValues.NODES.numberNode(value);
    }

    @Override
    public Double fromUser(final JsonNode data) {
        if (data != null && data.isNumber()) {
            return data.doubleValue();
        }
        final String text = UserValues.requireText(data, fieldType());
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw EncodingException.invalidValue("Invalid float: " + text, e);
        }
    }
}
