// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.method;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.DebugLogger;
import io.nanocodec.core.chain.Network;
import io.nanocodec.core.error.DecodingException;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.BufferExtract;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Argument lists of blueprint method calls.
 *
 * <p>
 * The wire form is the concatenation of the arguments' encodings in declaration order, with no
 * count prefix; the declared parameters tell the reader how many values follow.
 */
public final class MethodArgs {

    private MethodArgs() {}

    /**
     * Parses client input against the declared parameters.
     *
     * @throws EncodingException on an arity mismatch or invalid input
     */
    public static List<MethodArgument> parse(
            final List<MethodArgInfo> declared, final List<JsonNode> inputs, final Network network) {
        Objects.requireNonNull(declared, "declared");
        if (inputs == null) {
            throw EncodingException.arityMismatch("No arguments were received.");
        }
        checkArity(declared.size(), inputs.size());
        final List<MethodArgument> parsed = new ArrayList<>(declared.size());
        for (int i = 0; i < declared.size(); i++) {
            final MethodArgInfo info = declared.get(i);
            parsed.add(MethodArgument.fromApiInput(info.name(), info.type(), inputs.get(i), network));
        }
        return List.copyOf(parsed);
    }

    /**
     * Looks up the signature of {@code method} and parses {@code inputs} against it.
     *
     * @throws EncodingException if the method is unknown, on an arity mismatch or invalid input
     */
    public static List<MethodArgument> validateAndParse(
            final BlueprintMethods methods,
            final String blueprintId,
            final String method,
            final List<JsonNode> inputs,
            final Network network) {
        final List<MethodArgInfo> declared = methods.argsOf(blueprintId, method);
        if (declared == null) {
            throw EncodingException.invalidValue("Blueprint does not have method %s.".formatted(method));
        }
        DebugLogger.logParse("[method args] %s.%s declares %d args", blueprintId, method, declared.size());
        return parse(declared, inputs, network);
    }

    public static byte[] serialize(final List<MethodArgument> args, final Network network) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (MethodArgument arg : args) {
            out.writeBytes(arg.serialize(network));
        }
        final byte[] encoded = out.toByteArray();
        DebugLogger.logCodec("[method args] serialized %d args into %d bytes", args.size(), encoded.length);
        return encoded;
    }

    /**
     * Decodes one value per declared parameter. The buffer must be consumed exactly.
     *
     * @throws DecodingException on malformed input or trailing bytes
     */
    public static List<MethodArgument> deserialize(
            final List<MethodArgInfo> declared, final byte[] buf, final Network network) {
        Objects.requireNonNull(buf, "buf");
        final List<MethodArgument> args = new ArrayList<>(declared.size());
        int offset = 0;
        for (MethodArgInfo info : declared) {
            final BufferExtract<MethodArgument> extract =
                    MethodArgument.fromSerialized(info.name(), info.type(), buf, offset, network);
            args.add(extract.value());
            offset += extract.bytesRead();
        }
        if (offset != buf.length) {
            throw DecodingException.trailingBytes(buf.length - offset);
        }
        return List.copyOf(args);
    }

    private static void checkArity(final int expected, final int actual) {
        if (expected != actual) {
            throw EncodingException.arityMismatch(
                    "Method needs %d parameters but data has %d.".formatted(expected, actual));
        }
    }
}
