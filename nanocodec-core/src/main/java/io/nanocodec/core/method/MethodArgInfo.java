// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.method;

import java.util.Objects;

/**
 * One declared parameter of a blueprint method.
 *
 * @param name the parameter name
 * @param type the type descriptor, e.g. {@code "SignedData[int]"}
 */
public record MethodArgInfo(String name, String type) {

    public MethodArgInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static MethodArgInfo of(final String name, final String type) {
        return new MethodArgInfo(name, type);
    }
}
