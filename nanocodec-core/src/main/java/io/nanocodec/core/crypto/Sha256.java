// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 hashing utility backed by a per-thread {@link MessageDigest}.
 */
public final class Sha256 {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes {@code sha256(sha256(input))}, the hash behind address checksums.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] doubleHash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final MessageDigest digest = DIGEST.get();
        digest.reset();
        final byte[] first = digest.digest(input);
        return digest.digest(first);
    }
}
