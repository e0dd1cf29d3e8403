package com.shading.sgc.engine;

import com.shading.sgc.api.Node;
import com.shading.sgc.node.ConditionalNode;

import java.util.List;
import java.util.Map;

/**
 * Rewrites expression-valued conditionals into statement form.
 *
 * A conditional becomes a declared temporary assigned in both arms of an
 * if/else block; everywhere else the program refers to the temporary. Operands
 * that are themselves materialized (shared operators, nested conditionals)
 * were placed earlier by the {@link GraphAnalyzer}, so the block only ever
 * refers to them by name and no conditional is rendered recursively.
 */
public final class ConditionalLowering {

    public Statement.ConditionalBlock lower(ConditionalNode node, String temporary) {
        return new Statement.ConditionalBlock(temporary, node);
    }

    /**
     * Turns every materialized node of an analysis into its statement, in
     * evaluation order.
     *
     * @param analysis    The analyzed graph.
     * @param temporaries Temporary name of every materialized node, by id.
     */
    public List<Statement> lowerAll(Analysis analysis, Map<Long, String> temporaries) {
        return analysis.materializedInOrder().stream()
                .map(node -> toStatement(node, temporaries.get(node.id())))
                .toList();
    }

    private Statement toStatement(Node node, String temporary) {
        if (temporary == null)
            throw new IllegalStateException("No temporary allocated for " + node);
        if (node instanceof ConditionalNode c)
            return lower(c, temporary);
        return new Statement.Binding(temporary, node);
    }
}
