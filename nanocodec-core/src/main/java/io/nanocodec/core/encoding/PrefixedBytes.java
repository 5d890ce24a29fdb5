// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.encoding;

import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Length-prefixed byte strings: an unsigned LEB128 length followed by the payload.
 *
 * <p>
 * The decoder reads the prefix with a budget of {@link CodecLimits#MAX_LENGTH_PREFIX_BYTES}
 * groups and validates the declared length against {@link CodecLimits#MAX_ARG_BYTES_LENGTH}
 * and the remaining buffer before touching the payload.
 */
public final class PrefixedBytes {

    private PrefixedBytes() {
        // Utility class
    }

    /**
     * @throws EncodingException if the payload is longer than {@link CodecLimits#MAX_ARG_BYTES_LENGTH}
     */
    public static byte[] encode(final byte[] payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        if (payload.length > CodecLimits.MAX_ARG_BYTES_LENGTH) {
            throw EncodingException.invalidValue(
                    "Length %d exceeds the maximum of %d bytes".formatted(payload.length, CodecLimits.MAX_ARG_BYTES_LENGTH));
        }
        final byte[] prefix = Leb128.encodeUnsigned(payload.length);
        final byte[] result = new byte[prefix.length + payload.length];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        System.arraycopy(payload, 0, result, prefix.length, payload.length);
        return result;
    }

    public static BufferExtract<byte[]> decode(final byte[] buf, final int offset) {
        final BufferExtract<BigInteger> prefix =
                Leb128.decodeUnsigned(buf, offset, CodecLimits.MAX_LENGTH_PREFIX_BYTES);
        final BigInteger declared = prefix.value();
        if (declared.compareTo(BigInteger.valueOf(CodecLimits.MAX_ARG_BYTES_LENGTH)) > 0) {
            throw DecodingException.lengthTooLarge(declared.longValue(), CodecLimits.MAX_ARG_BYTES_LENGTH);
        }
        final int length = declared.intValue();
        final int start = offset + prefix.bytesRead();
        final int remaining = buf.length - start;
        if (remaining < length) {
            throw DecodingException.lengthExceedsBuffer(length, remaining);
        }
        return new BufferExtract<>(Arrays.copyOfRange(buf, start, start + length), prefix.bytesRead() + length);
    }

    public static byte[] encodeString(final String value) {
        Objects.requireNonNull(value, "value cannot be null");
        return encode(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes a length-prefixed UTF-8 string. Malformed UTF-8 is rejected rather than replaced.
     */
    public static BufferExtract<String> decodeString(final byte[] buf, final int offset) {
        final BufferExtract<byte[]> raw = decode(buf, offset);
        try {
            final String value = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw.value()))
                    .toString();
            return new BufferExtract<>(value, raw.bytesRead());
        } catch (CharacterCodingException e) {
            throw DecodingException.invalidValue("String is not valid UTF-8", e);
        }
    }
}
