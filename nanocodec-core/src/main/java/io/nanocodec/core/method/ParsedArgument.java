// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.method;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A method argument in its API form, ready to be sent back to a client.
 *
 * @param name   the parameter name
 * @param type   the type descriptor
 * @param parsed the JSON rendering of the value
 */
public record ParsedArgument(String name, String type, JsonNode parsed) {

    public ParsedArgument {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(parsed, "parsed");
    }
}
