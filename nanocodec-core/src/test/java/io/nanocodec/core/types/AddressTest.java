// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.types;

import static org.junit.jupiter.api.Assertions.*;

import io.nanocodec.core.chain.Networks;
import io.nanocodec.core.error.CodecErrorKind;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.primitives.Hex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AddressTest {

    static final String TESTNET_BASE58 = "WYLW8ujPemSuLJwbeNvvH6y7nakaJ6cEwT";
    static final String TESTNET_RAW = "4969ffb1549f2e00f30bfc0cf0b9207ed96f7f33ba578d4852";

    @Test
    void parsesBase58() {
        Address address = Address.fromBase58(TESTNET_BASE58, Networks.TESTNET);

        assertEquals(TESTNET_RAW, Hex.encode(address.toBytes()));
        assertEquals(0x49, address.version());
        assertEquals("69ffb1549f2e00f30bfc0cf0b9207ed96f7f33ba", Hex.encode(address.hash()));
        assertEquals(TESTNET_BASE58, address.toString());
    }

    @Test
    void decodesRawBytes() {
        Address address = Address.fromBytes(Hex.decode(TESTNET_RAW), Networks.TESTNET);

        assertEquals(TESTNET_BASE58, address.base58());
        assertEquals(address, Address.fromBase58(TESTNET_BASE58, Networks.TESTNET));
    }

    @Test
    void buildsFromHash() {
        Address address = Address.fromHash(
                0x49, Hex.decode("69ffb1549f2e00f30bfc0cf0b9207ed96f7f33ba"), Networks.TESTNET);

        assertEquals(TESTNET_BASE58, address.base58());
    }

    @Test
    @DisplayName("Tampered checksum is reported as a checksum error")
    void rejectsTamperedChecksum() {
        byte[] raw = Hex.decode(TESTNET_RAW);
        raw[24] ^= 0x01;

        DecodingException ex =
                assertThrows(DecodingException.class, () -> Address.fromBytes(raw, Networks.TESTNET));
        assertEquals(CodecErrorKind.CHECKSUM_MISMATCH, ex.kind());
    }

    @Test
    @DisplayName("A valid address of another network is a version error")
    void rejectsWrongNetwork() {
        byte[] raw = Hex.decode(TESTNET_RAW);

        DecodingException ex =
                assertThrows(DecodingException.class, () -> Address.fromBytes(raw, Networks.MAINNET));
        assertEquals(CodecErrorKind.VERSION_MISMATCH, ex.kind());

        EncodingException userEx = assertThrows(
                EncodingException.class, () -> Address.fromBase58(TESTNET_BASE58, Networks.MAINNET));
        assertEquals(CodecErrorKind.VERSION_MISMATCH, userEx.kind());
    }

    @Test
    void rejectsWrongLength() {
        DecodingException ex = assertThrows(
                DecodingException.class, () -> Address.fromBytes(new byte[24], Networks.TESTNET));
        assertEquals("Address should be 25 bytes long", ex.getMessage());
    }

    @Test
    void rejectsMalformedBase58() {
        assertThrows(EncodingException.class, () -> Address.fromBase58("WYLW0ujPemSuLJwbeNvvH6y7nakaJ6cEwT", Networks.TESTNET));
        assertThrows(EncodingException.class, () -> Address.fromBase58("WYLW", Networks.TESTNET));
        assertThrows(EncodingException.class, () -> Address.fromBase58(null, Networks.TESTNET));
    }

    @Test
    void copiesAreDefensive() {
        Address address = Address.fromBase58(TESTNET_BASE58, Networks.TESTNET);
        byte[] raw = address.toBytes();
        raw[0] = 0;

        assertEquals(0x49, address.version());
    }
}
