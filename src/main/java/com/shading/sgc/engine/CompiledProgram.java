package com.shading.sgc.engine;

import com.shading.sgc.api.Node;
import com.shading.sgc.node.VariableNode;

import java.util.List;
import java.util.Map;

/**
 * The linear program handed to the emitter.
 *
 * Invariants established by {@link ProgramCompiler}: every temporary used by a
 * statement or an output is declared by an earlier statement, and no two
 * declared identifiers (inputs, outputs, temporaries) are equal.
 *
 * @param inputs      Input declarations, in emission order.
 * @param outputs     Outputs, in root order.
 * @param statements  Statements, dependencies first.
 * @param temporaries Temporary name of every materialized node, by node id.
 */
public record CompiledProgram(List<VariableNode> inputs, List<OutputTarget> outputs,
        List<Statement> statements, Map<Long, String> temporaries) {

    public CompiledProgram {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        statements = List.copyOf(statements);
        temporaries = Map.copyOf(temporaries);
    }

    /**
     * Returns the temporary bound to the node, or null if the node is rendered
     * in place.
     */
    public String temporaryOf(Node node) {
        return temporaries.get(node.id());
    }
}
