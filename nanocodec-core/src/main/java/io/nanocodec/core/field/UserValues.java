// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.nanocodec.core.error.EncodingException;
import io.nanocodec.core.types.HexData;
import io.nanocodec.primitives.Hex;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Shape checks and coercions shared by the fields' {@code fromUser} and {@code toUser}.
 */
final class UserValues {
    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern DECIMAL = Pattern.compile("^-?\\d+$");

    private UserValues() {}

    static <T> T requireClass(final Object value, final Class<T> type, final String typeName) {
        if (!type.isInstance(value)) {
            throw EncodingException.wrongValueType(typeName, value);
        }
        return type.cast(value);
    }

    static String requireText(final JsonNode data, final String typeName) {
        if (data == null || !data.isTextual()) {
            throw EncodingException.unexpectedShape(typeName, data);
        }
        return data.textValue();
    }

    /**
     * Accepts decimal strings and integral JSON numbers. Fractions, exponents and other text
     * are rejected rather than truncated.
     */
    static BigInteger requireInteger(final JsonNode data, final String typeName) {
        if (data != null && data.isIntegralNumber()) {
            return data.bigIntegerValue();
        }
        if (data != null && data.isTextual()) {
            final String text = data.textValue().trim();
            if (DECIMAL.matcher(text).matches()) {
                return new BigInteger(text);
            }
        }
        throw EncodingException.unexpectedShape(typeName, data);
    }

    static boolean requireBoolean(final JsonNode data, final String typeName) {
        if (data != null && data.isBoolean()) {
            return data.booleanValue();
        }
        if (data != null && data.isTextual()) {
            switch (data.textValue()) {
                case "true":
                    return true;
                case "false":
                    return false;
                default:
                    break;
            }
        }
        throw EncodingException.unexpectedShape(typeName, data);
    }

    /**
     * Parses a non-prefixed hex string, optionally of an exact byte length.
     */
    static HexData requireHex(final JsonNode data, final String typeName, final int exactBytes) {
        final String text = requireText(data, typeName);
        if (!Hex.isHex(text) || (exactBytes >= 0 && text.length() != exactBytes * 2)) {
            throw EncodingException.unexpectedShape(typeName, data);
        }
        return HexData.of(text);
    }

    static HexData requireHex(final JsonNode data, final String typeName) {
        return requireHex(data, typeName, -1);
    }

    static JsonNode text(final String value) {
        return NODES.textNode(value);
    }
}
