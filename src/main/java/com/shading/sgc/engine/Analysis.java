package com.shading.sgc.engine;

import com.shading.sgc.api.Node;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of analyzing a root set: the evaluation order, how often each node is
 * referenced and which nodes must be bound to temporaries.
 *
 * @param discoveryOrder  Distinct nodes in order of first reference
 *                        (depth-first, roots in order, operands left to
 *                        right).
 * @param evaluationOrder Distinct nodes, dependencies first; ties broken by
 *                        discovery order.
 * @param multiplicity    Node id to number of operand and root slots
 *                        referencing it.
 * @param materialized    Ids of nodes that get their own statement.
 */
public record Analysis(List<Node> discoveryOrder, List<Node> evaluationOrder,
        Map<Long, Integer> multiplicity, Set<Long> materialized) {

    public Analysis {
        discoveryOrder = List.copyOf(discoveryOrder);
        evaluationOrder = List.copyOf(evaluationOrder);
        multiplicity = Map.copyOf(multiplicity);
        materialized = Set.copyOf(materialized);
    }

    public int nodeCount() {
        return evaluationOrder.size();
    }

    /** Number of parent positions (operand slots plus root slots) referencing the node. */
    public int referenceCount(Node node) {
        Integer c = multiplicity.get(node.id());
        if (c == null)
            throw new IllegalArgumentException("Node not part of the analyzed graph: " + node);
        return c;
    }

    public boolean isMaterialized(Node node) {
        return materialized.contains(node.id());
    }

    /** Materialized nodes in evaluation order; one statement each. */
    public List<Node> materializedInOrder() {
        return evaluationOrder.stream().filter(this::isMaterialized).toList();
    }
}
