// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.nctype;

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Leaf type names understood by the parser. Names are matched exactly, case included.
 */
public enum LeafType {
    STR("str"),
    INT("int"),
    VAR_INT("VarInt"),
    BOOL("bool"),
    FLOAT("float"),
    BYTES("bytes"),
    TX_OUTPUT_SCRIPT("TxOutputScript"),
    ADDRESS("Address"),
    TIMESTAMP("Timestamp"),
    AMOUNT("Amount"),
    TOKEN_UID("TokenUid"),
    BLUEPRINT_ID("BlueprintId"),
    CONTRACT_ID("ContractId"),
    VERTEX_ID("VertexId"),
    CALLER_ID("CallerId");

    private static final Map<String, LeafType> BY_NAME = new HashMap<>();

    static {
        for (LeafType leaf : values()) {
            BY_NAME.put(leaf.typeName, leaf);
        }
    }

    private final String typeName;

    LeafType(final String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Returns the leaf with exactly this name, or {@code null}.
     */
    public static @Nullable LeafType lookup(final String name) {
        return BY_NAME.get(name);
    }
}
