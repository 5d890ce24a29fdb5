// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.encoding;

import static org.junit.jupiter.api.Assertions.*;

import io.nanocodec.core.error.CodecErrorKind;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.primitives.Hex;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class Leb128Test {

    @ParameterizedTest(name = "{0} <-> {1}")
    @CsvSource({
        "0, 00",
        "2, 02",
        "-2, 7e",
        "127, ff00",
        "-127, 817f",
        "128, 8001",
        "-128, 807f",
        "129, 8101",
        "-129, ff7e",
        "63, 3f",
        "-64, 40",
        "64, c000"
    })
    @DisplayName("Signed values match the DWARF table")
    void signedTable(String value, String hex) {
        BigInteger n = new BigInteger(value);

        assertEquals(hex, Hex.encode(Leb128.encodeSigned(n)));
        BufferExtract<BigInteger> decoded = Leb128.decodeSigned(Hex.decode(hex), 0);
        assertEquals(n, decoded.value());
        assertEquals(hex.length() / 2, decoded.bytesRead());
    }

    @ParameterizedTest(name = "{0} <-> {1}")
    @CsvSource({"0, 00", "127, 7f", "128, 8001", "624485, e58e26", "65536, 808004"})
    void unsignedTable(String value, String hex) {
        BigInteger n = new BigInteger(value);

        assertEquals(hex, Hex.encode(Leb128.encodeUnsigned(n)));
        assertEquals(n, Leb128.decodeUnsigned(Hex.decode(hex), 0).value());
    }

    @Test
    void handlesValuesBeyond64Bits() {
        BigInteger big = BigInteger.TWO.pow(100).add(BigInteger.valueOf(12345));

        assertEquals(big, Leb128.decodeUnsigned(Leb128.encodeUnsigned(big), 0).value());
        assertEquals(big.negate(), Leb128.decodeSigned(Leb128.encodeSigned(big.negate()), 0).value());
    }

    @Test
    void decodesAtOffset() {
        byte[] buf = Hex.decode("ffff8001");

        BufferExtract<BigInteger> decoded = Leb128.decodeSigned(buf, 2);

        assertEquals(BigInteger.valueOf(128), decoded.value());
        assertEquals(2, decoded.bytesRead());
    }

    @Test
    void rejectsNegativeUnsigned() {
        EncodingException ex = assertThrows(
                EncodingException.class, () -> Leb128.encodeUnsigned(BigInteger.valueOf(-1)));
        assertEquals(CodecErrorKind.INVALID_VALUE, ex.kind());
    }

    @Test
    void enforcesMaxBytesOnEncode() {
        assertArrayEquals(Hex.decode("ffff03"), Leb128.encodeUnsigned(BigInteger.valueOf(65535), 3));
        assertThrows(EncodingException.class, () -> Leb128.encodeUnsigned(BigInteger.TWO.pow(21), 3));
        assertThrows(EncodingException.class, () -> Leb128.encodeSigned(BigInteger.valueOf(64), 1));
    }

    @Test
    void enforcesMaxBytesOnDecode() {
        DecodingException ex = assertThrows(
                DecodingException.class, () -> Leb128.decodeUnsigned(Hex.decode("80808001"), 0, 3));
        assertEquals(CodecErrorKind.MALFORMED_LENGTH, ex.kind());
    }

    @Test
    void rejectsUnterminatedInput() {
        assertThrows(DecodingException.class, () -> Leb128.decodeUnsigned(Hex.decode("8080"), 0));
        assertThrows(DecodingException.class, () -> Leb128.decodeSigned(new byte[0], 0));
    }
}
