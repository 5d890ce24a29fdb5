// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.encoding;

import io.nanocodec.core.error.CodecErrorKind;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * DWARF5 LEB128 variable-length integers over {@link BigInteger}.
 *
 * <p>
 * Each byte carries seven value bits, least significant group first; bit 7 flags that another
 * byte follows. Signed values stop once the remaining value is a clean sign extension of the
 * last group's bit 6.
 *
 * <pre>
 *    2 -&gt; 02        -2 -&gt; 7e
 *  127 -&gt; ff 00   -127 -&gt; 81 7f
 *  128 -&gt; 80 01   -128 -&gt; 80 7f
 * </pre>
 *
 * <p>
 * A {@code maxBytes} budget bounds attacker-controlled values: encoding fails when the value
 * needs more bytes, decoding fails as soon as one group too many has been read. {@code null}
 * means unbounded.
 */
public final class Leb128 {

    private static final BigInteger MINUS_ONE = BigInteger.ONE.negate();
    private static final BigInteger GROUP_MASK = BigInteger.valueOf(0x7F);

    private Leb128() {
        // Utility class
    }

    public static byte[] encodeSigned(final BigInteger value) {
        return encode(value, true, null);
    }

    public static byte[] encodeSigned(final BigInteger value, final @Nullable Integer maxBytes) {
        return encode(value, true, maxBytes);
    }

    public static byte[] encodeUnsigned(final BigInteger value) {
        return encode(value, false, null);
    }

    /**
     * @throws EncodingException if the value is negative or does not fit in {@code maxBytes}
     */
    public static byte[] encodeUnsigned(final BigInteger value, final @Nullable Integer maxBytes) {
        return encode(value, false, maxBytes);
    }

    public static byte[] encodeUnsigned(final long value) {
        return encode(BigInteger.valueOf(value), false, null);
    }

    public static BufferExtract<BigInteger> decodeSigned(final byte[] buf, final int offset) {
        return decode(buf, offset, true, null);
    }

    public static BufferExtract<BigInteger> decodeSigned(
            final byte[] buf, final int offset, final @Nullable Integer maxBytes) {
        return decode(buf, offset, true, maxBytes);
    }

    public static BufferExtract<BigInteger> decodeUnsigned(final byte[] buf, final int offset) {
        return decode(buf, offset, false, null);
    }

    /**
     * @throws DecodingException if the buffer ends mid-value or more than {@code maxBytes} groups are present
     */
    public static BufferExtract<BigInteger> decodeUnsigned(
            final byte[] buf, final int offset, final @Nullable Integer maxBytes) {
        return decode(buf, offset, false, maxBytes);
    }

    private static byte[] encode(final BigInteger value, final boolean signed, final @Nullable Integer maxBytes) {
        Objects.requireNonNull(value, "value cannot be null");
        if (!signed && value.signum() < 0) {
            throw EncodingException.invalidValue("Cannot encode an unsigned negative value: " + value);
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        BigInteger remaining = value;
        while (true) {
            final int group = remaining.and(GROUP_MASK).intValue();
            remaining = remaining.shiftRight(7);
            final boolean last;
            if (signed) {
                final boolean signBit = (group & 0x40) != 0;
                last = (remaining.signum() == 0 && !signBit) || (remaining.equals(MINUS_ONE) && signBit);
            } else {
                last = remaining.signum() == 0;
            }
            out.write(last ? group : group | 0x80);
            if (maxBytes != null && out.size() > maxBytes) {
                throw new EncodingException(
                        CodecErrorKind.INVALID_VALUE, "Cannot encode more than %d bytes".formatted(maxBytes));
            }
            if (last) {
                return out.toByteArray();
            }
        }
    }

    private static BufferExtract<BigInteger> decode(
            final byte[] buf, final int offset, final boolean signed, final @Nullable Integer maxBytes) {
        Objects.requireNonNull(buf, "buf cannot be null");
        BigInteger result = BigInteger.ZERO;
        int shift = 0;
        int pos = offset;
        while (true) {
            if (pos >= buf.length) {
                throw new DecodingException(
                        CodecErrorKind.TRUNCATED, "Buffer is not valid leb128, cannot read past the end of the buffer");
            }
            final int b = buf[pos++] & 0xFF;
            result = result.or(BigInteger.valueOf(b & 0x7F).shiftLeft(shift));
            shift += 7;
            if (maxBytes != null && shift / 7 > maxBytes) {
                throw DecodingException.leb128TooLong(maxBytes);
            }
            if ((b & 0x80) == 0) {
                if (signed && (b & 0x40) != 0) {
                    result = result.or(BigInteger.ONE.shiftLeft(shift).negate());
                }
                return new BufferExtract<>(result, pos - offset);
            }
        }
    }
}
