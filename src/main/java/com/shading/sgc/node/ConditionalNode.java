package com.shading.sgc.node;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.NodeKind;
import com.shading.sgc.types.TypeChecker;

import java.util.List;
import java.util.Objects;

/**
 * Expression-valued conditional: {@code condition ? whenTrue : whenFalse}.
 *
 * The target language's control flow is statement-only, so the compiler
 * always materializes a conditional into a temporary assigned in both arms
 * of an if/else block; it is never rendered inline.
 */
public final class ConditionalNode extends AbstractNode {
    private final Node condition;
    private final Node whenTrue;
    private final Node whenFalse;

    private ConditionalNode(Node condition, Node whenTrue, Node whenFalse) {
        super(TypeChecker.checkConditional(condition, whenTrue, whenFalse));
        this.condition = condition;
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse;
    }

    /**
     * Checks and builds the conditional.
     *
     * @throws com.shading.sgc.error.MalformedConditionalException if the
     *                                                             condition is
     *                                                             not bool or
     *                                                             the branches
     *                                                             do not unify.
     */
    public static ConditionalNode create(Node condition, Node whenTrue, Node whenFalse) {
        return new ConditionalNode(Objects.requireNonNull(condition, "condition"),
                Objects.requireNonNull(whenTrue, "whenTrue"), Objects.requireNonNull(whenFalse, "whenFalse"));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITIONAL;
    }

    @Override
    public List<Node> operands() {
        return List.of(condition, whenTrue, whenFalse);
    }

    public Node condition() {
        return condition;
    }

    public Node whenTrue() {
        return whenTrue;
    }

    public Node whenFalse() {
        return whenFalse;
    }
}
