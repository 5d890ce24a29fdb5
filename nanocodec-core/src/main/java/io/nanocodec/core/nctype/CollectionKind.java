// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.nctype;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * The four homogeneous collection containers. They share one wire layout; only the Java value
 * type differs ({@code List} for list and deque, insertion-ordered {@code Set} for the others).
 */
public enum CollectionKind {
    LIST("list", false),
    SET("set", true),
    DEQUE("deque", false),
    FROZENSET("frozenset", true);

    private final String typeName;
    private final boolean unique;

    CollectionKind(final String typeName, final boolean unique) {
        this.typeName = typeName;
        this.unique = unique;
    }

    public String typeName() {
        return typeName;
    }

    /** Whether elements are distinct and the value is a {@code Set}. */
    public boolean isUnique() {
        return unique;
    }

    /**
     * Matches a container name case-insensitively, or returns {@code null}.
     */
    public static @Nullable CollectionKind lookup(final String containerName) {
        final String lower = containerName.toLowerCase(Locale.ROOT);
        for (CollectionKind kind : values()) {
            if (kind.typeName.equals(lower)) {
                return kind;
            }
        }
        return null;
    }
}
