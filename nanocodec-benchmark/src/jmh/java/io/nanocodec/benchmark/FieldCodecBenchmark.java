// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.benchmark;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import io.nanocodec.core.NanoCodec;
import io.nanocodec.core.chain.Networks;
import io.nanocodec.core.field.FieldFactory;
import io.nanocodec.core.types.HexData;
import io.nanocodec.core.types.SignedData;

/**
 * JMH benchmark for field codecs on typical method arguments.
 *
 * <ul>
 *   <li>{@code dict*} - {@code Dict[str, list[Amount]]} with 50 entries</li>
 *   <li>{@code signed*} - {@code SignedData[str]} with a 64-byte signature</li>
 *   <li>{@code parseDescriptor} - descriptor parsing and field construction, bypassing the cache</li>
 * </ul>
 */
@State(Scope.Thread)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
public class FieldCodecBenchmark {

    private static final String DICT_TYPE = "Dict[str, list[Amount]]";
    private static final String SIGNED_TYPE = "SignedData[str]";

    private NanoCodec codec;
    private Map<String, List<BigInteger>> dict;
    private SignedData<String> signed;
    private byte[] dictEncoded;
    private byte[] signedEncoded;

    @Setup
    public void setup() {
        codec = new NanoCodec(Networks.MAINNET);

        dict = new LinkedHashMap<>();
        for (int i = 0; i < 50; i++) {
            List<BigInteger> amounts = new ArrayList<>();
            for (int j = 0; j < 10; j++) {
                amounts.add(BigInteger.valueOf(1_000_000L * i + j + 1));
            }
            dict.put("key" + i, amounts);
        }
        signed = SignedData.signed(
                "str", "oracle result", HexData.of("ab".repeat(64)), HexData.of("cd".repeat(32)));

        dictEncoded = codec.serialize(dict, DICT_TYPE);
        signedEncoded = codec.serialize(signed, SIGNED_TYPE);
    }

    @Benchmark
    public byte[] dictEncode() {
        return codec.serialize(dict, DICT_TYPE);
    }

    @Benchmark
    public Object dictDecode() {
        return codec.deserialize(dictEncoded, DICT_TYPE);
    }

    @Benchmark
    public byte[] signedEncode() {
        return codec.serialize(signed, SIGNED_TYPE);
    }

    @Benchmark
    public Object signedDecode() {
        return codec.deserialize(signedEncoded, SIGNED_TYPE);
    }

    @Benchmark
    public void parseDescriptor(Blackhole bh) {
        bh.consume(FieldFactory.fieldFor("list[Tuple[Address, Dict[str, SignedData[int]?]]]", Networks.MAINNET));
    }
}
