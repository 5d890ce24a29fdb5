// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsJsonSignature() {
        String input = "{\"type\":\"int\",\"signature\":\"abcdef0123\",\"value\":\"5\"}";

        assertEquals(
                "{\"type\":\"int\",\"signature\":\"***[REDACTED]***\",\"value\":\"5\"}",
                LogSanitizer.sanitize(input));
    }

    @Test
    void redactsRecordSignature() {
        String input = "SignedData[type=int, value=5, signature=HexData[value=abcdef], producerId=null]";

        assertEquals(
                "SignedData[type=int, value=5, signature=***[REDACTED]***, producerId=null]",
                LogSanitizer.sanitize(input));
    }

    @Test
    void truncatesToExactMaxLength() {
        String sanitized = LogSanitizer.sanitize("x".repeat(3000));

        assertEquals(2000, sanitized.length());
        assertEquals("x".repeat(1986) + "...(truncated)", sanitized);
    }

    @Test
    void doesNotTruncateAtExactLimit() {
        String exactLimit = "y".repeat(2000);

        assertEquals(exactLimit, LogSanitizer.sanitize(exactLimit));
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void leavesSafeDataUntouched() {
        String input = "[encode] Dict[str, int] -> 0103616263";
        assertEquals(input, LogSanitizer.sanitize(input));
        assertTrue(LogSanitizer.sanitize("signature").contains("signature"));
    }
}
