// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.types;

import io.nanocodec.core.encoding.CodecLimits;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Token identifier: either the native token or a 32-byte custom token uid.
 *
 * <p>The native token renders as {@code "00"}; custom tokens render as 64 lowercase hex characters.
 */
public final class TokenUid {
    public static final String NATIVE_UID = "00";

    public static final TokenUid NATIVE = new TokenUid(null);

    private static final Pattern CUSTOM_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final HexData custom;

    private TokenUid(final HexData custom) {
        this.custom = custom;
    }

    public static TokenUid custom(final HexData uid) {
        Objects.requireNonNull(uid, "uid");
        if (uid.byteLength() != CodecLimits.HASH_BYTES) {
            throw new IllegalArgumentException("Custom token uid must be 32 bytes, got " + uid.byteLength());
        }
        return new TokenUid(uid);
    }

    /**
     * Parses {@code "00"} or a 64-character hex uid.
     *
     * @throws IllegalArgumentException for any other string
     */
    public static TokenUid of(final String uid) {
        Objects.requireNonNull(uid, "uid");
        if (NATIVE_UID.equals(uid)) {
            return NATIVE;
        }
        if (!CUSTOM_PATTERN.matcher(uid).matches()) {
            throw new IllegalArgumentException("Invalid token uid: " + uid);
        }
        return custom(HexData.of(uid));
    }

    public boolean isNative() {
        return custom == null;
    }

    /**
     * Returns the 32-byte uid of a custom token.
     *
     * @throws IllegalStateException for the native token
     */
    public HexData uid() {
        if (custom == null) {
            throw new IllegalStateException("Native token has no 32-byte uid");
        }
        return custom;
    }

    public String value() {
        return custom == null ? NATIVE_UID : custom.value();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenUid)) {
            return false;
        }
        return Objects.equals(custom, ((TokenUid) o).custom);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(custom);
    }

    @Override
    public String toString() {
        return "TokenUid[" + value() + ']';
    }
}
