// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.method;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Source of blueprint method signatures, typically backed by a full node API.
 */
@FunctionalInterface
public interface BlueprintMethods {

    /**
     * Returns the declared parameters of {@code method}, or {@code null} if the blueprint has no
     * such public method.
     */
    @Nullable
    List<MethodArgInfo> argsOf(String blueprintId, String method);
}
