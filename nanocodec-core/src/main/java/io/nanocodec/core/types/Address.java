// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.types;

import io.nanocodec.core.chain.Network;
import io.nanocodec.core.crypto.Sha256;
import io.nanocodec.core.encoding.CodecLimits;
import io.nanocodec.core.error.CodecErrorKind;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.primitives.Base58;
import io.nanocodec.primitives.Hex;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Base58 address: one version byte, a 20-byte hash and a 4-byte checksum.
 *
 * <p>
 * <strong>Validation:</strong> instances are only created through the factories below, which
 * require
 * <ul>
 * <li>exactly 25 bytes</li>
 * <li>a checksum equal to the first 4 bytes of {@code sha256(sha256(version || hash))}</li>
 * <li>a version byte that is the network's P2PKH or P2SH version</li>
 * </ul>
 * Checks run in that order, so a tampered payload reports a checksum error before a version
 * error.
 */
public final class Address {
    /** Shape accepted from user input before decoding. */
    public static final Pattern BASE58_PATTERN =
            Pattern.compile("^[" + Base58.ALPHABET + "]{34,35}$");

    private static final int HASH_LENGTH = 20;
    private static final int CHECKSUM_LENGTH = 4;

    private final byte[] raw;
    private final String base58;

    private Address(final byte[] raw) {
        this.raw = raw;
        this.base58 = Base58.encode(raw);
    }

    /**
     * Validates a 25-byte payload read from the wire.
     *
     * @throws DecodingException with kind {@code MALFORMED_LENGTH}, {@code CHECKSUM_MISMATCH} or
     *                           {@code VERSION_MISMATCH}
     */
    public static Address fromBytes(final byte[] raw, final Network network) {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(network, "network");
        if (raw.length != CodecLimits.ADDRESS_BYTES) {
            throw new DecodingException(CodecErrorKind.MALFORMED_LENGTH, "Address should be 25 bytes long");
        }
        final byte[] expected = checksum(Arrays.copyOfRange(raw, 0, CodecLimits.ADDRESS_BYTES - CHECKSUM_LENGTH));
        final byte[] actual = Arrays.copyOfRange(raw, CodecLimits.ADDRESS_BYTES - CHECKSUM_LENGTH, raw.length);
        if (!Arrays.equals(expected, actual)) {
            throw new DecodingException(
                    CodecErrorKind.CHECKSUM_MISMATCH,
                    "Address checksum %s does not match computed %s".formatted(Hex.encode(actual), Hex.encode(expected)));
        }
        final int version = raw[0] & 0xFF;
        if (!network.acceptsVersion(version)) {
            throw new DecodingException(
                    CodecErrorKind.VERSION_MISMATCH,
                    "Address version byte 0x%02x is not valid for network %s".formatted(version, network.name()));
        }
        return new Address(raw.clone());
    }

    /**
     * Parses and validates a base58 address supplied by a user.
     *
     * @throws EncodingException if the string does not have address shape or fails validation
     */
    public static Address fromBase58(final String value, final Network network) {
        if (value == null || !BASE58_PATTERN.matcher(value).matches()) {
            throw EncodingException.invalidValue("Invalid address: " + value);
        }
        try {
            return fromBytes(Base58.decode(value), network);
        } catch (DecodingException e) {
            throw new EncodingException(e.kind(), "Invalid address " + value + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds an address from its version byte and 20-byte hash, computing the checksum.
     */
    public static Address fromHash(final int version, final byte[] hash, final Network network) {
        Objects.requireNonNull(hash, "hash");
        if (hash.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Address hash must be exactly 20 bytes");
        }
        final byte[] payload = new byte[1 + HASH_LENGTH];
        payload[0] = (byte) version;
        System.arraycopy(hash, 0, payload, 1, HASH_LENGTH);
        final byte[] raw = Arrays.copyOf(payload, CodecLimits.ADDRESS_BYTES);
        System.arraycopy(checksum(payload), 0, raw, payload.length, CHECKSUM_LENGTH);
        return fromBytes(raw, network);
    }

    public String base58() {
        return base58;
    }

    public byte[] toBytes() {
        return raw.clone();
    }

    public int version() {
        return raw[0] & 0xFF;
    }

    public byte[] hash() {
        return Arrays.copyOfRange(raw, 1, 1 + HASH_LENGTH);
    }

    private static byte[] checksum(final byte[] versionAndHash) {
        return Arrays.copyOf(Sha256.doubleHash(versionAndHash), CHECKSUM_LENGTH);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(raw, ((Address) o).raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return base58;
    }
}
