package com.shading.sgc.engine;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.NodeKind;
import com.shading.sgc.error.UnsupportedConstructException;
import com.shading.sgc.node.ConditionalNode;
import com.shading.sgc.node.LiteralNode;
import com.shading.sgc.node.OperatorNode;
import com.shading.sgc.node.VariableNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Linearizes an expression graph and decides which nodes need a temporary.
 *
 * The analysis runs in three steps over the whole root set at once, so
 * sub-expressions shared between different outputs are still evaluated once.
 *
 * 1. Discovery: an iterative depth-first walk from the roots (in order,
 * operands left to right) gives every distinct node, by identity, a discovery
 * index on its first reference. Each operand slot and each root slot adds one
 * to the referenced node's multiplicity.
 *
 * 2. Ordering: Kahn's algorithm over operand -> consumer edges. Among the nodes
 * whose dependencies are all placed, the one discovered first goes next, which
 * makes the order reproducible for a given construction sequence.
 *
 * 3. Materialization: an operator referenced more than once, and every
 * conditional, is bound to a temporary. Literals and variables are always
 * rendered in place.
 *
 * Analyzers are stateless and may be reused.
 */
@Log4j2
public final class GraphAnalyzer {

    public Analysis analyze(List<? extends Node> roots) {
        if (roots.isEmpty())
            throw new IllegalArgumentException("Nothing to analyze: empty root set");

        // 1. Discovery (preorder) and multiplicity
        List<Node> discovered = new ArrayList<>();
        Map<Long, Integer> indexById = new HashMap<>();
        Map<Long, Integer> multiplicity = new HashMap<>();

        Deque<Node> stack = new ArrayDeque<>();
        for (Node root : roots) {
            Objects.requireNonNull(root, "root");
            multiplicity.merge(root.id(), 1, Integer::sum);
            stack.push(root);
            while (!stack.isEmpty()) {
                Node curr = stack.pop();
                if (indexById.containsKey(curr.id()))
                    continue;
                requireSupported(curr);
                indexById.put(curr.id(), discovered.size());
                discovered.add(curr);

                List<Node> operands = curr.operands();
                for (Node op : operands)
                    multiplicity.merge(op.id(), 1, Integer::sum);
                // Reverse push keeps left-to-right visiting order
                for (int i = operands.size() - 1; i >= 0; i--)
                    stack.push(operands.get(i));
            }
        }

        // 2. Kahn's algorithm, smallest discovery index first
        int n = discovered.size();
        int[] inDegree = new int[n];
        List<List<Integer>> consumers = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            consumers.add(new ArrayList<>());
        for (int i = 0; i < n; i++) {
            for (Node op : discovered.get(i).operands()) {
                consumers.get(indexById.get(op.id())).add(i);
                inDegree[i]++;
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                ready.add(i);

        List<Node> ordered = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int curr = ready.poll();
            ordered.add(discovered.get(curr));
            for (int consumer : consumers.get(curr))
                if (--inDegree[consumer] == 0)
                    ready.add(consumer); // All operands placed
        }
        if (ordered.size() != n)
            throw new IllegalStateException("Cycle detected! Processed " + ordered.size() + " of " + n);

        // 3. Materialization
        Set<Long> materialized = new HashSet<>();
        for (Node node : ordered) {
            if (node.kind() == NodeKind.CONDITIONAL
                    || (node.kind() == NodeKind.OPERATOR && multiplicity.get(node.id()) > 1))
                materialized.add(node.id());
        }

        log.debug("Analyzed {} roots: {} distinct nodes, {} materialized", roots.size(), n, materialized.size());
        return new Analysis(discovered, ordered, multiplicity, materialized);
    }

    /**
     * Only the four node variants of this compiler are understood; anything else
     * was built against a different core.
     */
    private static void requireSupported(Node node) {
        if (node.kind() == null)
            throw new UnsupportedConstructException("Untagged node " + node.getClass().getName(), node.id());
        boolean known = switch (node.kind()) {
            case LITERAL -> node instanceof LiteralNode;
            case OPERATOR -> node instanceof OperatorNode;
            case VARIABLE -> node instanceof VariableNode;
            case CONDITIONAL -> node instanceof ConditionalNode;
        };
        if (!known)
            throw new UnsupportedConstructException(
                    "Unsupported node implementation " + node.getClass().getName() + " tagged " + node.kind(),
                    node.id());
    }
}
