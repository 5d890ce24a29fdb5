// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.chain.Network;
import io.nanocodec.core.encoding.PrefixedBytes;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.Address;
import io.nanocodec.core.types.BufferExtract;
import java.util.Objects;

/**
 * Address as its 25-byte payload inside a length prefix, validated against one network.
 *
 * <pre>
 * 19 | version(1) | hash(20) | checksum(4)
 * </pre>
 */
public final class AddressField implements NcField<Address> {
    private static final NcType TYPE = new NcType.Simple(LeafType.ADDRESS);

    private final Network network;

    public AddressField(final Network network) {
        this.network = Objects.requireNonNull(network, "network");
    }

    public Network network() {
        return network;
    }

    @Override
    public NcType type() {
        return TYPE;
    }

    @Override
    public String fieldType() {
        return "Address";
    }

    @Override
    public Address cast(final Object value) {
        return UserValues.requireClass(value, Address.class, fieldType());
    }

    /**
     * @throws EncodingException if the address does not belong to this field's network
     */
    @Override
    public byte[] encode(final Address value) {
        if (!network.acceptsVersion(value.version())) {
            throw EncodingException.invalidValue(
                    "Address %s does not belong to network %s".formatted(value.base58(), network.name()));
        }
        return PrefixedBytes.encode(value.toBytes());
    }

    @Override
    public BufferExtract<Address> decode(final byte[] buf, final int offset) {
        final BufferExtract<byte[]> raw = PrefixedBytes.decode(buf, offset);
        return new BufferExtract<>(Address.fromBytes(raw.value(), network), raw.bytesRead());
    }

    @Override
    public JsonNode toUser(final Address value) {
        return UserValues.text(value.base58());
    }

    @Override
    public Address fromUser(final JsonNode data) {
        return Address.fromBase58(UserValues.requireText(data, fieldType()), network);
    }
}
