// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.encoding.CodecLimits;
import io.nanocodec.core.encoding.SizedBytes;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.nctype.LeafType;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.core.types.HexData;
import io.nanocodec.core.types.TokenUid;

/**
 * Tagged token id: {@code 00} for the native token, {@code 01 || uid(32)} for a custom one.
 */
public final class TokenUidField implements NcField<TokenUid> {
    private static final NcType TYPE = new NcType.Simple(LeafType.TOKEN_UID);

    private static final int NATIVE_TAG = 0x00;
    private static final int CUSTOM_TAG = 0x01;

    @Override
    public NcType type() {
        return TYPE;
    }

    @Override
    public String fieldType() {
        return "TokenUid";
    }

    @Override
    public TokenUid cast(final Object value) {
        return UserValues.requireClass(value, TokenUid.class, fieldType());
    }

    @Override
    public byte[] encode(final TokenUid value) {
        if (value.isNative()) {
            return new byte[] {NATIVE_TAG};
        }
        final byte[] uid = value.uid().toBytes();
        final byte[] out = new byte[1 + uid.length];
        out[0] = CUSTOM_TAG;
        System.arraycopy(uid, 0, out, 1, uid.length);
        return out;
    }

    @Override
    public BufferExtract<TokenUid> decode(final byte[] buf, final int offset) {
        if (offset >= buf.length) {
            throw DecodingException.noData();
        }
        final int tag = buf[offset] & 0xFF;
        if (tag == NATIVE_TAG) {
            return new BufferExtract<>(TokenUid.NATIVE, 1);
        }
        if (tag == CUSTOM_TAG) {
            final BufferExtract<byte[]> uid = SizedBytes.decode(CodecLimits.HASH_BYTES, buf, offset + 1);
            return new BufferExtract<>(TokenUid.custom(HexData.fromBytes(uid.value())), 1 + uid.bytesRead());
        }
        throw DecodingException.invalidTag("TokenUid", tag);
    }

    @Override
    public JsonNode toUser(final TokenUid value) {
        return UserValues.text(value.value());
    }

    @Override
    public TokenUid fromUser(final JsonNode data) {
        final String text = UserValues.requireText(data, fieldType());
        try {
            return TokenUid.of(text);
        } catch (IllegalArgumentException e) {
            throw EncodingException.invalidValue(e.getMessage(), e);
        }
    }
}
