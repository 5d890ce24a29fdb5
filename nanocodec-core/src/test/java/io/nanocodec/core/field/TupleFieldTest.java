// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nanocodec.core.error.CodecErrorKind;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.core.types.HexData;
import io.nanocodec.primitives.Hex;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TupleFieldTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TupleField field = new TupleField(List.of(new StrField(), new IntField(), new BoolField()));

    @Test
    void concatenatesWithoutPrefix() {
        byte[] encoded = field.encode(List.of("ab", BigInteger.valueOf(-2), true));

        assertEquals("0261627e01", Hex.encode(encoded));
        assertEquals("Tuple[str, int, bool]", field.type().typeName());
    }

    @Test
    void decodesSequentially() {
        BufferExtract<List<Object>> decoded = field.decode(Hex.decode("0261627e01ee"));

        assertEquals(List.of("ab", BigInteger.valueOf(-2), true), decoded.value());
        assertEquals(5, decoded.bytesRead());
    }

    @Test
    void convertsUserForm() throws Exception {
        List<Object> parsed = field.fromUser(mapper.readTree("[\"ab\", \"-2\", \"true\"]"));

        assertEquals(List.of("ab", BigInteger.valueOf(-2), true), parsed);
        assertEquals(mapper.readTree("[\"ab\", \"-2\", \"true\"]"), field.toUser(parsed));
    }

    @Test
    void rejectsArityMismatch() throws Exception {
        EncodingException ex = assertThrows(
                EncodingException.class, () -> field.fromUser(mapper.readTree("[\"ab\", \"1\"]")));
        assertEquals(CodecErrorKind.ARITY_MISMATCH, ex.kind());
        assertTrue(ex.getMessage().startsWith("Mismatched number of values from type"));

        assertThrows(EncodingException.class, () -> field.encode(List.of("ab")));
        assertThrows(EncodingException.class, () -> field.fromUser(mapper.readTree("{}")));
    }

    @Test
    void nestsContainers() {
        TupleField nested = new TupleField(List.of(
                new BytesField(), new OptionalField<>(new TupleField(List.of(new AmountField())))));
        List<Object> value = List.of(HexData.of("ff"), Optional.of(List.of(BigInteger.TEN)));

        byte[] encoded = nested.encodeObject(value);

        assertEquals("01ff010a", Hex.encode(encoded));
        assertEquals(value, nested.decode(encoded).value());
    }
}
