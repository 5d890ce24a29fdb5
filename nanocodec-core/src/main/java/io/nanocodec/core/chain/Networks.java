// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.chain;

import java.util.Locale;

public final class Networks {
    private Networks() {}

    /** Addresses start with {@code H} (P2PKH) or {@code h} (P2SH). */
    public static final Network MAINNET = Network.of("mainnet", 0x28, 0x64);

    /** Addresses start with {@code W} (P2PKH) or {@code w} (P2SH). */
    public static final Network TESTNET = Network.of("testnet", 0x49, 0x87);

    /**
     * Resolves a well-known network by name or alias ({@code production}, {@code test}).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Network byName(final String name) {
        if (name == null) {
            throw new IllegalArgumentException("Network name cannot be null");
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "mainnet":
            case "production":
                return MAINNET;
            case "testnet":
            case "test":
                return TESTNET;
            default:
                throw new IllegalArgumentException("Unknown network: " + name);
        }
    }
}
