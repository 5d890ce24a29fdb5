// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.chain;

import java.util.Objects;

/**
 * Address configuration of a network.
 *
 * <p>
 * A network supplies the two version bytes that may lead a 25-byte address payload. Every codec
 * that reads or writes addresses is bound to one network at construction time.
 *
 * @param name         the network name, e.g. {@code mainnet}
 * @param p2pkhVersion version byte of pay-to-public-key-hash addresses (0..255)
 * @param p2shVersion  version byte of pay-to-script-hash addresses (0..255)
 *
 * @see Networks
 */
public record Network(String name, int p2pkhVersion, int p2shVersion) {

    /**
     * @throws IllegalArgumentException if the name is blank or a version does not fit in one byte
     * @throws NullPointerException if name is null
     */
    public Network {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        requireByte("p2pkhVersion", p2pkhVersion);
        requireByte("p2shVersion", p2shVersion);
    }

    public static Network of(final String name, final int p2pkhVersion, final int p2shVersion) {
        return new Network(name, p2pkhVersion, p2shVersion);
    }

    /**
     * Returns {@code true} when {@code version} is this network's P2PKH or P2SH version byte.
     */
    public boolean acceptsVersion(final int version) {
        final int v = version & 0xFF;
        return v == p2pkhVersion || v == p2shVersion;
    }

    private static void requireByte(final String field, final int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(field + " must fit in one byte, got: " + value);
        }
    }
}
