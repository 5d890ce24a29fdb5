// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nanocodec.core.chain.Networks;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.primitives.Hex;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DictFieldTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DictField<String, BigInteger> field = new DictField<>(new StrField(), new IntField());

    private static Map<String, BigInteger> sample() {
        Map<String, BigInteger> map = new LinkedHashMap<>();
        map.put("b", BigInteger.ONE);
        map.put("a", BigInteger.valueOf(-2));
        return map;
    }

    @Test
    void encodesCountThenPairs() {
        assertEquals("02" + "016201" + "01617e", Hex.encode(field.encode(sample())));
    }

    @Test
    void decodePreservesWireOrder() {
        BufferExtract<Map<String, BigInteger>> decoded = field.decode(Hex.decode("0201620101617e"));

        assertEquals(7, decoded.bytesRead());
        assertEquals(sample(), decoded.value());
        assertEquals(List.of("b", "a"), List.copyOf(decoded.value().keySet()));
    }

    @Test
    void rejectsDuplicateKeysOnDecode() {
        assertThrows(DecodingException.class, () -> field.decode(Hex.decode("020161010161 02".replace(" ", ""))));
    }

    @Test
    void userFormIsObject() throws Exception {
        JsonNode user = mapper.readTree("{\"b\":\"1\",\"a\":-2}");

        Map<String, BigInteger> parsed = field.fromUser(user);

        assertEquals(sample(), parsed);
        assertEquals(mapper.readTree("{\"b\":\"1\",\"a\":\"-2\"}"), field.toUser(parsed));
        assertThrows(EncodingException.class, () -> field.fromUser(mapper.readTree("[]")));
    }

    @Test
    void nonTextKeysUseTheirJsonForm() throws Exception {
        DictField<?, ?> nested = (DictField<?, ?>) FieldFactory.fieldFor("Dict[Tuple[str, int], bool]", Networks.TESTNET);

        Object parsed = nested.fromUser(mapper.readTree("{\"[\\\"x\\\",\\\"3\\\"]\":\"true\"}"));
        JsonNode back = nested.toUserObject(parsed);

        assertEquals(Map.of(List.of("x", BigInteger.valueOf(3)), true), parsed);
        assertTrue(back.has("[\"x\",\"3\"]"));
    }

    @Test
    void timestampKeysRoundTripThroughText() throws Exception {
        DictField<?, ?> byTime = (DictField<?, ?>) FieldFactory.fieldFor("Dict[Timestamp, str]", Networks.TESTNET);

        Object parsed = byTime.fromUser(mapper.readTree("{\"1700000000\":\"x\"}"));

        assertEquals(mapper.readTree("{\"1700000000\":\"x\"}"), byTime.toUserObject(parsed));
    }
}
