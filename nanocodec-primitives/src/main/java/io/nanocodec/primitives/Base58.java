// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.primitives;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Base58 text encoding over the Bitcoin alphabet.
 *
 * <p>Leading zero bytes map to leading {@code '1'} characters in both directions. No checksum is
 * applied here; callers that need Base58Check append and verify their own.
 */
public final class Base58 {
    public static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    private static final char[] ALPHABET_CHARS = ALPHABET.toCharArray();
    private static final BigInteger BASE = BigInteger.valueOf(58);
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET_CHARS.length; i++) {
            INDEXES[ALPHABET_CHARS[i]] = i;
        }
    }

    private Base58() {
        // Utility class
    }

    /**
     * Encodes bytes to a Base58 string.
     *
     * @param input the bytes to encode
     * @return the Base58 text, empty for an empty array
     * @throws IllegalArgumentException if {@code input} is {@code null}
     */
    public static String encode(final byte[] input) {
        if (input == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) {
            zeros++;
        }
        final StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        while (value.signum() > 0) {
            final BigInteger[] divRem = value.divideAndRemainder(BASE);
            sb.append(ALPHABET_CHARS[divRem[1].intValue()]);
            value = divRem[0];
        }
        for (int i = 0; i < zeros; i++) {
            sb.append(ALPHABET_CHARS[0]);
        }
        return sb.reverse().toString();
    }

    /**
     * Decodes a Base58 string.
     *
     * @param input the text to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null or contains a character outside the alphabet
     */
    public static byte[] decode(final String input) {
        if (input == null) {
            throw new IllegalArgumentException("Base58 string cannot be null");
        }
        int zeros = 0;
        while (zeros < input.length() && input.charAt(zeros) == ALPHABET_CHARS[0]) {
            zeros++;
        }
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            final int digit = c < INDEXES.length ? INDEXES[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid base58 character '" + c + "' in: " + input);
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        final byte[] magnitude = value.signum() == 0 ? new byte[0] : stripSignByte(value.toByteArray());
        final byte[] out = new byte[zeros + magnitude.length];
        System.arraycopy(magnitude, 0, out, zeros, magnitude.length);
        return out;
    }

    /**
     * Returns {@code true} when every character of {@code value} belongs to the alphabet.
     */
    public static boolean isBase58(final String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c >= INDEXES.length || INDEXES[c] < 0) {
                return false;
            }
        }
        return true;
    }

    private static byte[] stripSignByte(final byte[] bytes) {
        if (bytes.length > 1 && bytes[0] == 0) {
            final byte[] out = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, out, 0, out.length);
            return out;
        }
        return bytes;
    }
}
