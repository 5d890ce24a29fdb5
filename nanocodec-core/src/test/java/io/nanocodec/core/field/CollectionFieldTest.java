// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nanocodec.core.error.CodecErrorKind;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.CollectionKind;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.primitives.Hex;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class CollectionFieldTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static List<BigInteger> ints(long... values) {
        return java.util.Arrays.stream(values).mapToObj(BigInteger::valueOf).toList();
    }

    @ParameterizedTest
    @EnumSource(CollectionKind.class)
    void allKindsShareOneLayout(CollectionKind kind) {
        CollectionField<BigInteger> field = new CollectionField<>(kind, new IntField());

        byte[] encoded = field.encode(ints(1, 2, 300));

        assertEquals("030102ac02", Hex.encode(encoded));
        BufferExtract<Collection<BigInteger>> decoded = field.decode(encoded);
        assertEquals(5, decoded.bytesRead());
        assertEquals(ints(1, 2, 300), List.copyOf(decoded.value()));
    }

    @Test
    void listKeepsDuplicatesAndSetRejectsThem() {
        CollectionField<BigInteger> list = new CollectionField<>(CollectionKind.LIST, new IntField());
        CollectionField<BigInteger> set = new CollectionField<>(CollectionKind.SET, new IntField());
        byte[] duplicated = Hex.decode("03010101");

        assertEquals(ints(1, 1, 1), list.decode(duplicated).value());
        DecodingException ex = assertThrows(DecodingException.class, () -> set.decode(duplicated));
        assertEquals(CodecErrorKind.INVALID_VALUE, ex.kind());
        assertThrows(EncodingException.class, () -> set.encode(ints(1, 1)));
        assertThrows(EncodingException.class, () -> set.fromUser(mapper.readTree("[\"1\", \"1\"]")));
    }

    @Test
    void setDecodesToOrderedSet() {
        CollectionField<String> frozen = new CollectionField<>(CollectionKind.FROZENSET, new StrField());

        Collection<String> decoded = frozen.decode(Hex.decode("02016201 61".replace(" ", ""))).value();

        assertInstanceOf(Set.class, decoded);
        assertEquals(List.of("b", "a"), List.copyOf(decoded));
        assertThrows(UnsupportedOperationException.class, () -> decoded.add("c"));
    }

    @Test
    void emptyCollection() {
        CollectionField<String> field = new CollectionField<>(CollectionKind.DEQUE, new StrField());

        assertEquals("00", Hex.encode(field.encode(List.of())));
        assertTrue(field.decode(new byte[] {0}).value().isEmpty());
    }

    @Test
    void countLargerThanRemainingBytesIsRejected() {
        CollectionField<BigInteger> field = new CollectionField<>(CollectionKind.LIST, new IntField());

        DecodingException ex = assertThrows(DecodingException.class, () -> field.decode(Hex.decode("ffffffff0f01")));
        assertEquals(CodecErrorKind.MALFORMED_LENGTH, ex.kind());
        assertThrows(DecodingException.class, () -> field.decode(Hex.decode("0301")));
    }

    @Test
    void userFormIsArray() throws Exception {
        CollectionField<BigInteger> field = new CollectionField<>(CollectionKind.LIST, new AmountField());

        Collection<BigInteger> parsed = field.fromUser(mapper.readTree("[\"5\", 6]"));

        assertEquals(ints(5, 6), parsed);
        assertEquals(mapper.readTree("[\"5\", \"6\"]"), field.toUser(parsed));
        assertThrows(EncodingException.class, () -> field.fromUser(mapper.readTree("\"5\"")));
    }
}
