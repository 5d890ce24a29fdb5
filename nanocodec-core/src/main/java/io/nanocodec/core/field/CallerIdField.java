// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.chain.Network;
import io.nanocodec.core.encoding.CodecLimits;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.Address;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.core.types.CallerId;
import io.nanocodec.core.types.HexData;
import io.nanocodec.primitives.Hex;
import java.util.Objects;

/**
 * Caller identity: {@code 00 || address} or {@code 01 || contractId(32)}.
 *
 * <p>User input that is 64 hex characters is a contract id; anything else is parsed as an address.
 */
public final class CallerIdField implements NcField<CallerId> {
    private static final NcType TYPE = new NcType.Simple(LeafType.CALLER_ID);

    private final AddressField addressField;
    private final Bytes32Field contractField = new Bytes32Field(LeafType.CONTRACT_ID);

    public CallerIdField(final Network network) {
        this.addressField = new AddressField(Objects.requireNonNull(network, "network"));
    }

    @Override
    public NcType type() {
        return TYPE;
    }

    @Override
    public String fieldType() {
        return "CallerId";
    }

    @Override
    public CallerId cast(final Object value) {
        return UserValues.requireClass(value, CallerId.class, fieldType());
    }

    @Override
    public byte[] encode(final CallerId value) {
        final byte[] payload;
        if (value instanceof CallerId.AddressCaller address) {
            payload = addressField.encode(address.address());
        } else {
            payload = contractField.encode(((CallerId.ContractCaller) value).contractId());
        }
        final byte[] out = new byte[1 + payload.length];
        out[0] = (byte) value.tag();
        System.arraycopy(payload, 0, out, 1, payload.length);
        return out;
    }

    @Override
    public BufferExtract<CallerId> decode(final byte[] buf, final int offset) {
        if (offset >= buf.length) {
            throw DecodingException.noData();
        }
        final int tag = buf[offset] & 0xFF;
        if (tag == CallerId.AddressCaller.TAG) {
            final BufferExtract<Address> address = addressField.decode(buf, offset + 1);
            return new BufferExtract<>(CallerId.of(address.value()), 1 + address.bytesRead());
        }
        if (tag == CallerId.ContractCaller.TAG) {
            final BufferExtract<HexData> contract = contractField.decode(buf, offset + 1);
            return new BufferExtract<>(CallerId.of(contract.value()), 1 + contract.bytesRead());
        }
        throw DecodingException.invalidTag("CallerId", tag);
    }

    @Override
    public JsonNode toUser(final CallerId value) {
        return UserValues.text(value.value());
    }

    @Override
    public CallerId fromUser(final JsonNode data) {
        final String text = UserValues.requireText(data, fieldType());
        if (text.length() == CodecLimits.HASH_BYTES * 2 && Hex.isHex(text)) {
            return CallerId.of(contractField.fromUser(data));
        }
        return CallerId.of(addressField.fromUser(data));
    }
}
