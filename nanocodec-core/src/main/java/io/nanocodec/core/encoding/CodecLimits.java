// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.encoding;

/**
 * Wire-format limits shared by the node and every codec.
 */
public final class CodecLimits {

    /** Largest byte or string payload a method argument may carry (64 KiB). */
    public static final int MAX_ARG_BYTES_LENGTH = 1 << 16;

    /** LEB128 group budget for a length prefix; {@link #MAX_ARG_BYTES_LENGTH} needs exactly three. */
    public static final int MAX_LENGTH_PREFIX_BYTES = 3;

    /** Version byte, 20-byte hash and 4-byte checksum. */
    public static final int ADDRESS_BYTES = 25;

    /** Contract, blueprint, vertex and custom token ids. */
    public static final int HASH_BYTES = 32;

    public static final int TIMESTAMP_BYTES = 4;

    public static final int FLOAT_BYTES = 8;

    private CodecLimits() {
        // Constants holder
    }
}
