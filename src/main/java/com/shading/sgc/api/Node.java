package com.shading.sgc.api;

import java.util.List;

/**
 * A node in a shader expression graph.
 *
 * This interface represents the fundamental unit of the graph the compiler
 * consumes. Every node -- whether it's a literal, an external input, an
 * operator application or an expression-valued conditional -- implements this
 * interface.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every node has a process-unique id assigned at construction and
 * never reused. Identity, not structural content, is what the compiler uses to
 * detect sharing: two independently built but equal subtrees are two distinct
 * nodes.
 *
 * 2. Typing: Every node carries its result type, inferred and checked when the
 * node was constructed. A node whose operands do not type-check cannot exist.
 *
 * 3. Structure: Operator and conditional nodes reference (never own) their
 * operands. The same operand may be referenced from many parents.
 *
 * Nodes are immutable and must not override equals/hashCode.
 */
public interface Node {

    /**
     * Returns the process-unique identifier of this node.
     *
     * @return A monotonic id, never reused within the process.
     */
    long id();

    /**
     * Returns the variant tag of this node.
     */
    NodeKind kind();

    /**
     * Returns the result type of this node.
     */
    ShaderType type();

    /**
     * Returns the ordered operand list; empty for literals and variables.
     * Conditionals return {@code [condition, then, else]}.
     */
    List<Node> operands();
}
