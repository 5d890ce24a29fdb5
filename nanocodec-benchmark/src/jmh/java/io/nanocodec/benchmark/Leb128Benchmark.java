// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.benchmark;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;

import io.nanocodec.core.encoding.Leb128;
import io.nanocodec.core.types.BufferExtract;

/**
 * JMH benchmark for LEB128 throughput.
 *
 * <p>{@code small} fits one group, {@code large} is a 128-bit amount that needs nineteen.
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
public class Leb128Benchmark {

    private BigInteger small;
    private BigInteger large;
    private byte[] smallEncoded;
    private byte[] largeEncoded;

    @Setup
    public void setup() {
        small = BigInteger.valueOf(42);
        large = BigInteger.TWO.pow(128).subtract(BigInteger.ONE).negate();
        smallEncoded = Leb128.encodeSigned(small);
        largeEncoded = Leb128.encodeSigned(large);
    }

    @Benchmark
    public byte[] encodeSmall() {
        return Leb128.encodeSigned(small);
    }

    @Benchmark
    public byte[] encodeLarge() {
        return Leb128.encodeSigned(large);
    }

    @Benchmark
    public BufferExtract<BigInteger> decodeSmall() {
        return Leb128.decodeSigned(smallEncoded, 0);
    }

    @Benchmark
    public BufferExtract<BigInteger> decodeLarge() {
        return Leb128.decodeSigned(largeEncoded, 0);
    }
}
