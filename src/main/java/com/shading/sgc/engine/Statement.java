package com.shading.sgc.engine;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.node.ConditionalNode;

/**
 * One step of the linear program: the evaluation of a materialized node into a
 * freshly declared temporary.
 */
public interface Statement {

    /** Name of the temporary this statement declares. */
    String temporary();

    /** The node whose value the temporary holds. */
    Node node();

    default ShaderType type() {
        return node().type();
    }

    /** {@code type temp = expr;} */
    record Binding(String temporary, Node node) implements Statement {
    }

    /**
     * {@code type temp; if (c) { temp = a; } else { temp = b; }}
     */
    record ConditionalBlock(String temporary, ConditionalNode node) implements Statement {

        public Node condition() {
            return node.condition();
        }

        public Node whenTrue() {
            return node.whenTrue();
        }

        public Node whenFalse() {
            return node.whenFalse();
        }
    }
}
