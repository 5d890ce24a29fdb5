// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.CodecLimits;
import io.nanocodec.core.encoding.FixedNumbers;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import java.math.BigInteger;

/**
 * Unix timestamp in seconds as a 4-byte signed big-endian integer. Rendered as a JSON number.
 */
public final class TimestampField implements NcField<BigInteger> {
    private static final NcType TYPE = new NcType.Simple(LeafType.TIMESTAMP);

    @Override
    public NcType type() {
        return TYPE;
    }

    @Override
    public String fieldType() {
        return "Timestamp";
    }

    @Override
    public BigInteger cast(final Object value) {
        return UserValues.requireClass(value, BigInteger.class, fieldType());
    }

    @Override
    public byte[] encode(final BigInteger value) {
        return FixedNumbers.encodeInt(value, CodecLimits.TIMESTAMP_BYTES, true);
    }

    @Override
    public BufferExtract<BigInteger> decode(final byte[] buf, final int offset) {
        return FixedNumbers.decodeInt(buf, offset, CodecLimits.TIMESTAMP_BYTES, true);
    }

    @Override
    public JsonNode toUser(final BigInteger value) {
        return UserValues.NODES.numberNode(checkRange(value).intValue());
    }

    @Override
    public BigInteger fromUser(final JsonNode data) {
        return checkRange(UserValues.requireInteger(data, fieldType()));
    }

    // throws when outside the signed 32-bit range
    private static BigInteger checkRange(final BigInteger value) {
        FixedNumbers.encodeInt(value, CodecLimits.TIMESTAMP_BYTES, true);
        return value;
    }
}
