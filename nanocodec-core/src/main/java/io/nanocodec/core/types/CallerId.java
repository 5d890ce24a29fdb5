// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.types;

import io.nanocodec.core.encoding.CodecLimits;
import java.util.Objects;

/**
 * Identity of a method caller: a wallet address or another contract.
 */
public sealed interface CallerId {

    /** Wire tag preceding the payload. */
    int tag();

    /** Text form: base58 for addresses, hex for contract ids. */
    String value();

    static CallerId of(final Address address) {
        return new AddressCaller(address);
    }

    static CallerId of(final HexData contractId) {
        return new ContractCaller(contractId);
    }

    record AddressCaller(Address address) implements CallerId {
        public static final int TAG = 0x00;

        public AddressCaller {
            Objects.requireNonNull(address, "address");
        }

        @Override
        public int tag() {
            return TAG;
        }

        @Override
        public String value() {
            return address.base58();
        }
    }

    record ContractCaller(HexData contractId) implements CallerId {
        public static final int TAG = 0x01;

        public ContractCaller {
            Objects.requireNonNull(contractId, "contractId");
            if (contractId.byteLength() != CodecLimits.HASH_BYTES) {
                throw new IllegalArgumentException("Contract id must be 32 bytes, got " + contractId.byteLength());
            }
        }

        @Override
        public int tag() {
            return TAG;
        }

        @Override
        public String value() {
            return contractId.value();
        }
    }
}
