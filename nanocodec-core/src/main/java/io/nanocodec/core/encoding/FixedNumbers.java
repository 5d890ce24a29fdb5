// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.encoding;

import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-width big-endian integers and IEEE-754 doubles.
 */
public final class FixedNumbers {

    private FixedNumbers() {
        // Utility class
    }

    /**
     * Encodes {@code value} in {@code size} bytes, two's complement when {@code signed}.
     *
     * @throws EncodingException if the value is out of range for the width
     */
    public static byte[] encodeInt(final BigInteger value, final int size, final boolean signed) {
        Objects.requireNonNull(value, "value cannot be null");
        final int bits = size * 8;
        final BigInteger min = signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
        final BigInteger max = signed
                ? BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw EncodingException.invalidValue(
                    "Value %s does not fit in %s %d-byte integer".formatted(value, signed ? "a signed" : "an unsigned", size));
        }
        final byte[] twos = value.toByteArray();
        final byte[] out = new byte[size];
        final byte pad = value.signum() < 0 ? (byte) 0xFF : 0;
        Arrays.fill(out, pad);
        final int copy = Math.min(size, twos.length);
        System.arraycopy(twos, twos.length - copy, out, size - copy, copy);
        return out;
    }

    public static BufferExtract<BigInteger> decodeInt(
            final byte[] buf, final int offset, final int size, final boolean signed) {
        final byte[] raw = SizedBytes.read(buf, offset, size, "%d-byte integer".formatted(size));
        final BigInteger value = signed ? new BigInteger(raw) : new BigInteger(1, raw);
        return new BufferExtract<>(value, size);
    }

    public static byte[] encodeDouble(final double value) {
        return ByteBuffer.allocate(CodecLimits.FLOAT_BYTES).putDouble(value).array();
    }

    public static BufferExtract<Double> decodeDouble(final byte[] buf, final int offset) {
        final byte[] raw = SizedBytes.read(buf, offset, CodecLimits.FLOAT_BYTES, "float");
        return new BufferExtract<>(ByteBuffer.wrap(raw).getDouble(), CodecLimits.FLOAT_BYTES);
    }
}
