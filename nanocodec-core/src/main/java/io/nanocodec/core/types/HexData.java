// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.types;

import io.nanocodec.primitives.Hex;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable byte blob rendered as lowercase hex without prefix.
 *
 * <p>
 * Used for the {@code bytes} family ({@code bytes}, {@code TxOutputScript}) and the 32-byte
 * identifiers ({@code ContractId}, {@code BlueprintId}, {@code VertexId}), as well as for
 * signatures and producer ids of signed envelopes.
 *
 * <pre>{@code
 * HexData script = HexData.of("76a914...88ac");
 * HexData fromBytes = HexData.fromBytes(new byte[] {0x01, 0x02});
 * byte[] raw = script.toBytes();
 * }</pre>
 */
public final class HexData {
    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;
    private String value;

    private HexData(final byte[] raw) {
        this.raw = raw;
    }

    /**
     * Parses a hex string. A {@code 0x} prefix is tolerated.
     *
     * @throws IllegalArgumentException if the string is not valid hex
     * @throws NullPointerException if {@code hex} is null
     */
    public static HexData of(final String hex) {
        Objects.requireNonNull(hex, "hex");
        final String clean = Hex.cleanPrefix(hex);
        if (!Hex.isHex(clean)) {
            throw new IllegalArgumentException("Invalid hex data: " + hex);
        }
        return fromBytes(Hex.decode(clean));
    }

    /**
     * Wraps a copy of {@code bytes}.
     *
     * @param bytes the byte array, or null/empty for {@link #EMPTY}
     */
    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    /**
     * Returns the lowercase hex string. Generated lazily and cached.
     */
    public String value() {
        String v = value;
        if (v == null) {
            v = Hex.encode(raw);
            value = v;
        }
        return v;
    }

    public int byteLength() {
        return raw.length;
    }

    public byte[] toBytes() {
        return raw.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(raw, ((HexData) o).raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[value=" + value() + ']';
    }
}
