package com.shading.sgc.api;

import java.util.List;

/**
 * The operator vocabulary of a shading-language dialect.
 *
 * A table is a closed, read-only mapping from operator symbol to its typed
 * overloads. It is injected into the type checker, the graph builder, the
 * compiler and the emitter; supplying a different table changes language
 * coverage without touching the compilation algorithm.
 *
 * Implementations must be immutable and safe to share across threads.
 */
public interface SignatureTable {

    /**
     * Returns a short identifier of the dialect, e.g. {@code "glsl-es-100"}.
     */
    String dialect();

    /**
     * Returns every overload of the operator, in preference order.
     *
     * @param operator The operator symbol.
     * @return The overloads; empty if the table does not know the operator.
     */
    List<Signature> signatures(String operator);

    /**
     * Returns true if the given overload belongs to this table.
     */
    default boolean supports(Signature signature) {
        return signatures(signature.operator()).contains(signature);
    }
}
