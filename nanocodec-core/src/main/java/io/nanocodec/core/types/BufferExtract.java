// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.types;

/**
 * Result of decoding one value from a buffer.
 *
 * <p>The caller advances its own offset by exactly {@code bytesRead} to reach the next value.
 *
 * @param value     the decoded value
 * @param bytesRead number of bytes consumed, never negative
 * @param <T>       the value type
 */
public record BufferExtract<T>(T value, int bytesRead) {

    public BufferExtract {
        if (bytesRead < 0) {
            throw new IllegalArgumentException("bytesRead cannot be negative: " + bytesRead);
        }
    }
}
