// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.primitives.Hex;
import java.math.BigInteger;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OptionalFieldTest {

    private final OptionalField<BigInteger> field = new OptionalField<>(new IntField());

    @Test
    void absentIsSingleZeroByte() {
        assertEquals("00", Hex.encode(field.encode(Optional.empty())));
        assertEquals("00", Hex.encode(new OptionalField<>(new StrField()).encode(Optional.empty())));
    }

    @Test
    void presentIsOneFollowedByInner() {
        byte[] inner = new IntField().encode(BigInteger.valueOf(300));

        assertEquals("01" + Hex.encode(inner), Hex.encode(field.encode(Optional.of(BigInteger.valueOf(300)))));
    }

    @Test
    void decodeReportsBytesRead() {
        BufferExtract<Optional<BigInteger>> absent = field.decode(Hex.decode("00ff"));
        BufferExtract<Optional<BigInteger>> present = field.decode(Hex.decode("01ac02"));

        assertEquals(Optional.empty(), absent.value());
        assertEquals(1, absent.bytesRead());
        assertEquals(Optional.of(BigInteger.valueOf(300)), present.value());
        assertEquals(3, present.bytesRead());
    }

    @Test
    void rejectsUnknownPresenceTag() {
        assertThrows(DecodingException.class, () -> field.decode(Hex.decode("02ac02")));
        assertThrows(DecodingException.class, () -> field.decode(new byte[0]));
    }

    @Test
    void userFormIsNullOrInner() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;

        assertTrue(field.toUser(Optional.empty()).isNull());
        assertEquals(nodes.textNode("7"), field.toUser(Optional.of(BigInteger.valueOf(7))));
        assertEquals(Optional.empty(), field.fromUser(nodes.nullNode()));
        assertEquals(Optional.empty(), field.fromUser(MissingNode.getInstance()));
        assertEquals(Optional.of(BigInteger.valueOf(7)), field.fromUser(nodes.textNode("7")));
    }
}
