package com.shading.sgc.emit;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.Signature;
import com.shading.sgc.api.SignatureTable;
import com.shading.sgc.error.UnsupportedConstructException;
import com.shading.sgc.node.LiteralNode;
import com.shading.sgc.node.OperatorNode;
import com.shading.sgc.node.VariableNode;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders expressions of one compiled program.
 *
 * Materialized nodes are referenced by their temporary; everything else is
 * substituted into its operator's syntax recursively. Parentheses are added
 * only where precedence requires them.
 */
final class ExpressionRenderer {
    private final SignatureTable table;
    private final Map<Long, String> temporaries;

    /** Rendered text and the precedence of its outermost operator. */
    private record Fragment(String text, int precedence) {
    }

    ExpressionRenderer(SignatureTable table, Map<Long, String> temporaries) {
        this.table = table;
        this.temporaries = temporaries;
    }

    /**
     * Renders a reference to the node as a complete expression.
     *
     * @param expected Type required by the context; only affects int literals
     *                 promoted to float.
     */
    String reference(Node node, ShaderType expected) {
        return fragment(node, expected).text();
    }

    /**
     * Renders the defining expression of a materialized operator, ignoring its
     * own temporary.
     */
    String definition(Node node) {
        if (node instanceof OperatorNode op)
            return operator(op).text();
        throw new IllegalStateException("Only operators are bound with an initializer: " + node);
    }

    private Fragment fragment(Node node, ShaderType expected) {
        String temp = temporaries.get(node.id());
        if (temp != null)
            return new Fragment(temp, Signature.ATOMIC);

        return switch (node.kind()) {
            case LITERAL -> {
                String text = LiteralFormat.format((LiteralNode) node, expected);
                yield new Fragment(text, text.startsWith("-") ? Signature.UNARY : Signature.ATOMIC);
            }
            case VARIABLE -> new Fragment(((VariableNode) node).name(), Signature.ATOMIC);
            case OPERATOR -> operator((OperatorNode) node);
            case CONDITIONAL -> throw new IllegalStateException(
                    "Conditional #" + node.id() + " reached expression rendering without a temporary");
        };
    }

    private Fragment operator(OperatorNode node) {
        Signature sig = node.signature();
        if (!table.supports(sig))
            throw new UnsupportedConstructException(
                    "Operator " + sig + " is not part of dialect " + table.dialect(), node.id());

        List<Node> operands = node.operands();
        List<ShaderType> params = sig.parameters();
        int prec = sig.precedence();

        return switch (sig.syntax()) {
            case INFIX -> {
                Fragment left = fragment(operands.get(0), params.get(0));
                Fragment right = fragment(operands.get(1), params.get(1));
                yield new Fragment(wrap(left, left.precedence() < prec) + " " + sig.operator() + " "
                        + wrap(right, right.precedence() <= prec), prec);
            }
            case PREFIX -> {
                Fragment operand = fragment(operands.get(0), params.get(0));
                yield new Fragment(sig.operator() + wrap(operand, operand.precedence() <= prec), prec);
            }
            case CALL -> {
                StringJoiner args = new StringJoiner(", ", sig.operator() + "(", ")");
                for (int i = 0; i < operands.size(); i++)
                    args.add(fragment(operands.get(i), params.get(i)).text());
                yield new Fragment(args.toString(), prec);
            }
            case FIELD -> {
                Fragment base = fragment(operands.get(0), params.get(0));
                yield new Fragment(wrap(base, base.precedence() < prec) + sig.operator(), prec);
            }
        };
    }

    private static String wrap(Fragment f, boolean parenthesize) {
        return parenthesize ? "(" + f.text() + ")" : f.text();
    }
}
