// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.Leb128;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import java.math.BigInteger;

/**
 * Token amount as unsigned LEB128. User input must be strictly positive; zero can still be
 * encoded and decoded directly.
 */
public final class AmountField implements NcField<BigInteger> {
    private static final NcType TYPE = new NcType.Simple(LeafType.AMOUNT);

    @Override
    public NcType type() {
        return TYPE;
    }

    @Override
    public String fieldType() {
        return "Amount";
    }

    @Override
    public BigInteger cast(final Object value) {
        return UserValues.requireClass(value, BigInteger.class, fieldType());
    }

    @Override
    public byte[] encode(final BigInteger value) {
        return Leb128.encodeUnsigned(value);
    }

    @Override
    public BufferExtract<BigInteger> decode(final byte[] buf, final int offset) {
        return Leb128.decodeUnsigned(buf, offset);
    }

    @Override
    public JsonNode toUser(final BigInteger value) {
        return UserValues.text(value.toString());
    }

    @Override
    public BigInteger fromUser(final JsonNode data) {
        final BigInteger value = UserValues.requireInteger(data, fieldType());
        if (value.signum() <= 0) {
            throw EncodingException.invalidValue("Amount must be positive, got " + value);
        }
        return value;
    }
}
