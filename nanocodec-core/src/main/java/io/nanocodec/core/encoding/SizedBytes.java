// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.encoding;

import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-size byte strings with no prefix, such as 32-byte ids.
 */
public final class SizedBytes {

    private SizedBytes() {
        // Utility class
    }

    public static byte[] encode(final int size, final byte[] value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.length != size) {
            throw EncodingException.invalidValue("Expected %d bytes but got %d".formatted(size, value.length));
        }
        return value.clone();
    }

    public static BufferExtract<byte[]> decode(final int size, final byte[] buf, final int offset) {
        return new BufferExtract<>(read(buf, offset, size, "%d-byte value".formatted(size)), size);
    }

    /**
     * Copies {@code length} bytes starting at {@code offset}.
     *
     * @throws DecodingException if fewer than {@code length} bytes remain
     */
    static byte[] read(final byte[] buf, final int offset, final int length, final String what) {
        final int available = Math.max(0, buf.length - offset);
        if (available < length) {
            throw DecodingException.truncated(what, length, available);
        }
        return Arrays.copyOfRange(buf, offset, offset + length);
    }
}
