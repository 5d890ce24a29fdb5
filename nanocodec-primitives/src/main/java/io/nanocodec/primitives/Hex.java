// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.primitives;

/**
 * Lowercase hex encoding as used by the node API.
 *
 * <p>Output never carries a {@code 0x} prefix. {@link #decode(String)} tolerates one so that
 * values copied from other tooling still parse.
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        java.util.Arrays.fill(NIBBLE_LOOKUP, -1);
        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix, into bytes.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has odd length or contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        final String clean = cleanPrefix(hexString);
        if ((clean.length() & 1) == 1) {
            throw new IllegalArgumentException("Hex string must have an even length: " + hexString);
        }
        final byte[] result = new byte[clean.length() / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(clean.charAt(i * 2), hexString);
            final int low = toNibble(clean.charAt(i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return the hex string, empty for an empty array
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Returns {@code true} when {@code value} is a non-prefixed hex string of even length.
     *
     * @param value candidate string, may be {@code null}
     * @return whether every character is a hex digit and the length is even
     */
    public static boolean isHex(final String value) {
        if (value == null || (value.length() & 1) == 1) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Removes a leading {@code 0x} or {@code 0X} if present.
     *
     * @param hexString the string to clean
     * @return the string without prefix
     * @throws IllegalArgumentException if {@code hexString} is {@code null}
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("Invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
