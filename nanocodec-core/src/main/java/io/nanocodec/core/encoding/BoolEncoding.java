// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.encoding;

import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.types.BufferExtract;

/**
 * Single-byte booleans: {@code 0x00} false, {@code 0x01} true.
 */
public final class BoolEncoding {

    private BoolEncoding() {
        // Utility class
    }

    public static byte[] encode(final boolean value) {
        return new byte[] {(byte) (value ? 1 : 0)};
    }

    public static BufferExtract<Boolean> decode(final byte[] buf, final int offset) {
        if (offset >= buf.length) {
            throw DecodingException.noData();
        }
        switch (buf[offset]) {
            case 0:
                return new BufferExtract<>(Boolean.FALSE, 1);
            case 1:
                return new BufferExtract<>(Boolean.TRUE, 1);
            default:
                throw DecodingException.invalidTag("boolean", buf[offset]);
        }
    }
}
