// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.encoding;

import static org.junit.jupiter.api.Assertions.*;

import io.nanocodec.core.error.CodecErrorKind;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.primitives.Hex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PrefixedBytesTest {

    @Test
    @DisplayName("A 2048-byte string gets the two-byte prefix 80 10")
    void longStringPrefix() {
        String value = "a".repeat(2048);

        byte[] encoded = PrefixedBytes.encodeString(value);

        assertEquals(2050, encoded.length);
        assertEquals((byte) 0x80, encoded[0]);
        assertEquals((byte) 0x10, encoded[1]);
        BufferExtract<String> decoded = PrefixedBytes.decodeString(encoded, 0);
        assertEquals(value, decoded.value());
        assertEquals(2050, decoded.bytesRead());
    }

    @Test
    void encodesUtf8() {
        assertEquals("03616263", Hex.encode(PrefixedBytes.encodeString("abc")));
        assertEquals("02c3a9", Hex.encode(PrefixedBytes.encodeString("é")));
        assertEquals("00", Hex.encode(PrefixedBytes.encode(new byte[0])));
    }

    @Test
    @DisplayName("Declared lengths above the limit fail before the payload is read")
    void rejectsOversizedLengthBeforePayload() {
        // 65537, with no payload bytes behind it
        byte[] prefix = Leb128.encodeUnsigned(65537);

        DecodingException ex = assertThrows(DecodingException.class, () -> PrefixedBytes.decode(prefix, 0));
        assertEquals(CodecErrorKind.MALFORMED_LENGTH, ex.kind());
        assertTrue(ex.getMessage().contains("65537"));
    }

    @Test
    void rejectsLengthBeyondBuffer() {
        DecodingException ex =
                assertThrows(DecodingException.class, () -> PrefixedBytes.decode(Hex.decode("05616263"), 0));
        assertEquals(CodecErrorKind.MALFORMED_LENGTH, ex.kind());
    }

    @Test
    void rejectsPrefixLongerThanThreeBytes() {
        byte[] buf = new byte[64];
        buf[0] = (byte) 0x80;
        buf[1] = (byte) 0x80;
        buf[2] = (byte) 0x80;
        buf[3] = 0x01;

        DecodingException ex = assertThrows(DecodingException.class, () -> PrefixedBytes.decode(buf, 0));

        assertEquals(CodecErrorKind.MALFORMED_LENGTH, ex.kind());
    }

    @Test
    void acceptsMaximumLength() {
        byte[] payload = new byte[CodecLimits.MAX_ARG_BYTES_LENGTH];

        byte[] encoded = PrefixedBytes.encode(payload);

        assertEquals(payload.length + 3, PrefixedBytes.decode(encoded, 0).bytesRead());
        assertThrows(EncodingException.class, () -> PrefixedBytes.encode(new byte[payload.length + 1]));
    }

    @Test
    void rejectsMalformedUtf8() {
        assertThrows(DecodingException.class, () -> PrefixedBytes.decodeString(Hex.decode("01ff"), 0));
    }

    @Test
    void doesNotMutateInput() {
        byte[] buf = Hex.decode("0203040506");
        byte[] copy = buf.clone();

        byte[] value = PrefixedBytes.decode(buf, 0).value();
        value[0] = 0x7f;

        assertArrayEquals(copy, buf);
    }
}
