// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nanocodec.core.chain.Networks;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.NanoCodecException;
import io.nanocodec.core.error.TypeParseException;
import io.nanocodec.core.field.NcField;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.primitives.Hex;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NanoCodecTest {

    private final NanoCodec codec = new NanoCodec(Networks.TESTNET);
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void serializesByDescriptor() {
        assertEquals("ac02", Hex.encode(codec.serialize(BigInteger.valueOf(300), "int")));
        assertEquals("00", Hex.encode(codec.serialize(Optional.empty(), "Dict[str, int]?")));
    }

    @Test
    void deserializesAtOffset() {
        byte[] buf = Hex.decode("ffff0261627e");

        BufferExtract<?> first = codec.deserialize(buf, 2, "str");
        BufferExtract<?> second = codec.deserialize(buf, 2 + first.bytesRead(), "int");

        assertEquals("ab", first.value());
        assertEquals(BigInteger.valueOf(-2), second.value());
        assertEquals(buf.length, 2 + first.bytesRead() + second.bytesRead());
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
        "str|\"hello\"",
        "int|\"-123456789012345678901234567890\"",
        "Amount|\"18446744073709551616\"",
        "bool|\"false\"",
        "bytes|\"00ff\"",
        "Timestamp|1700000000",
        "TokenUid|\"00\"",
        "Address|\"WYLW8ujPemSuLJwbeNvvH6y7nakaJ6cEwT\"",
        "int?|null",
        "Tuple[str, VarInt]|[\"a\", \"1\"]",
        "list[bool]|[\"true\", \"false\", \"true\"]",
        "Dict[str, list[Amount]]|{\"x\": [\"1\", \"2\"], \"y\": []}",
        "RawSignedData[str]|{\"type\": \"str\", \"signature\": \"aa\", \"value\": \"v\"}"
    })
    void userFormSurvivesTheWire(String descriptor, String json) throws Exception {
        JsonNode input = mapper.readTree(json);

        Object value = codec.fromUser(input, descriptor);
        byte[] wire = codec.serialize(value, descriptor);
        BufferExtract<?> decoded = codec.deserialize(wire, descriptor);

        assertEquals(value, decoded.value());
        assertEquals(wire.length, decoded.bytesRead());
        assertArrayEquals(wire, codec.serialize(decoded.value(), descriptor));
        assertEquals(input, codec.toUser(decoded.value(), descriptor));
    }

    @Test
    void cachesParsedDescriptors() {
        assertSame(codec.field("list[int]"), codec.field("list[int]"));
        NcType type = codec.type("list[int]");

        codec.clearCache();

        assertNotSame(type, codec.field("list[int]").type());
        assertEquals(type, codec.type("list[int]"));
    }

    @Test
    void whitespaceVariantsShareOneCacheEntry() {
        NcField<?> field = codec.field("int");

        assertSame(field, codec.field(" int "));
        assertSame(field, codec.field("int\t"));
        assertSame(codec.field("dict[str,int]"), codec.field("Dict[ str , int ]"));
        assertEquals(2, codec.cachedTypeCount());
    }

    @Test
    void cacheStaysWithinItsBound() {
        NanoCodec small = new NanoCodec(Networks.TESTNET, 8);

        for (int i = 0; i < 5_000; i++) {
            small.field("int" + " ".repeat(i % 50) + "?".repeat(i % 20));
        }

        assertTrue(small.cachedTypeCount() <= 8);
    }

    @Test
    void evictsLeastRecentlyUsedType() {
        NanoCodec small = new NanoCodec(Networks.TESTNET, 2);
        NcField<?> str = small.field("str");
        small.field("int");
        small.field("str");

        small.field("bool");

        assertSame(str, small.field("str"));
        assertEquals(2, small.cachedTypeCount());
        assertThrows(IllegalArgumentException.class, () -> new NanoCodec(Networks.TESTNET, 0));
    }

    @Test
    void errorsShareOneHierarchy() {
        assertThrows(TypeParseException.class, () -> codec.serialize("x", "Nope[int]"));
        NanoCodecException ex =
                assertThrows(DecodingException.class, () -> codec.deserialize(new byte[] {0x02}, "bool"));
        assertNotNull(ex.kind());
        assertFalse(NanoCodec.isValidDescriptor("list[int"));
        assertTrue(NanoCodec.isValidDescriptor("list[int]"));
    }

    @Test
    void doesNotMutateInput() {
        byte[] buf = codec.serialize(List.of("a", "b"), "list[str]");
        byte[] copy = buf.clone();

        codec.deserialize(buf, "list[str]");

        assertArrayEquals(copy, buf);
        assertSame(Networks.TESTNET, codec.network());
    }
}
