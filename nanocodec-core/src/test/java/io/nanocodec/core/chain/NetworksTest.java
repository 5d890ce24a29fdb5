// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.chain;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NetworksTest {

    @Test
    void wellKnownVersionBytes() {
        assertEquals(0x28, Networks.MAINNET.p2pkhVersion());
        assertEquals(0x64, Networks.MAINNET.p2shVersion());
        assertEquals(0x49, Networks.TESTNET.p2pkhVersion());
        assertEquals(0x87, Networks.TESTNET.p2shVersion());
    }

    @ParameterizedTest
    @ValueSource(strings = {"mainnet", "production", "MAINNET"})
    void resolvesMainnetAliases(String name) {
        assertSame(Networks.MAINNET, Networks.byName(name));
    }

    @Test
    void resolvesTestnet() {
        assertSame(Networks.TESTNET, Networks.byName("test"));
        assertThrows(IllegalArgumentException.class, () -> Networks.byName("privatenet"));
        assertThrows(IllegalArgumentException.class, () -> Networks.byName(null));
    }

    @Test
    void acceptsOnlyOwnVersions() {
        assertTrue(Networks.TESTNET.acceptsVersion(0x87));
        assertFalse(Networks.TESTNET.acceptsVersion(0x28));
    }

    @Test
    void validatesCustomNetworks() {
        Network custom = Network.of("privatenet", 0x70, 0x71);
        assertTrue(custom.acceptsVersion(0x71));

        assertThrows(IllegalArgumentException.class, () -> Network.of("x", 256, 0));
        assertThrows(IllegalArgumentException.class, () -> Network.of(" ", 1, 2));
    }
}
