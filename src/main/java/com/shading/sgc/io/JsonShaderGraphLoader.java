package com.shading.sgc.io;

import com.shading.sgc.api.Node;
import com.shading.sgc.api.Precision;
import com.shading.sgc.api.ShaderType;
import com.shading.sgc.api.SignatureTable;
import com.shading.sgc.api.VariableKind;
import com.shading.sgc.config.CompileOptions;
import com.shading.sgc.engine.CompiledProgram;
import com.shading.sgc.engine.ProgramCompiler;
import com.shading.sgc.node.ConditionalNode;
import com.shading.sgc.node.LiteralNode;
import com.shading.sgc.node.OperatorNode;
import com.shading.sgc.node.VariableNode;
import com.shading.sgc.types.TypeChecker;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Builds shader graphs from JSON {@link ShaderGraphDefinition}s.
 *
 * Node names are wiring labels only: every reference to a label is a reference
 * to the same node, which is how a definition expresses sharing. Variables
 * take their GLSL name from the {@code identifier} property, or from the label
 * when it is absent.
 *
 * <pre>
 * { "shader": {
 *     "name": "fade",
 *     "options": { "version": "100", "precision": "mediump" },
 *     "nodes": [
 *       { "name": "a", "type": "attribute", "properties": { "glslType": "float" } },
 *       { "name": "s", "type": "operator", "properties": { "op": "sin" }, "inputs": { "i0": "a" } }
 *     ],
 *     "outputs": { "v_Value": "s" } } }
 * </pre>
 */
@Log4j2
public final class JsonShaderGraphLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SignatureTable table;
    private final TypeChecker checker;

    public JsonShaderGraphLoader(SignatureTable table) {
        this.table = Objects.requireNonNull(table, "table");
        this.checker = new TypeChecker(table);
    }

    /** Parses a JSON string into a definition. */
    public static ShaderGraphDefinition parse(String json) {
        try {
            ShaderGraphDefinition def = MAPPER.readValue(json, ShaderGraphDefinition.class);
            if (def.getShader() == null)
                throw new IllegalArgumentException("Missing 'shader' key");
            return def;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed shader graph definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON file into a definition. */
    public static ShaderGraphDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public LoadedShaderGraph load(String json) {
        return load(parse(json));
    }

    public LoadedShaderGraph load(Path path) throws IOException {
        return load(parseFile(path));
    }

    /**
     * Builds the nodes of a definition.
     *
     * @throws IllegalArgumentException for unknown types, operators without an
     *                                  {@code op} property, duplicate labels or
     *                                  outputs naming unknown labels.
     * @throws IllegalStateException    if some nodes can never be resolved (a
     *                                  cycle or a missing input).
     * @throws com.shading.sgc.error.TypeCheckException if an operator or
     *                                                  conditional does not
     *                                                  type-check.
     */
    public LoadedShaderGraph load(ShaderGraphDefinition def) {
        ShaderGraphDefinition.ShaderInfo info = def.getShader();

        // 0. Pre-process templates
        Map<String, ShaderGraphDefinition.TemplateDef> templateMap = new HashMap<>();
        if (info.getTemplates() != null) {
            for (ShaderGraphDefinition.TemplateDef t : info.getTemplates())
                templateMap.put(t.getName(), t);
        }
        List<ShaderGraphDefinition.NodeDef> nodeDefs = expandTemplates(
                info.getNodes() != null ? info.getNodes() : List.of(), templateMap);

        Set<String> labels = new HashSet<>();
        for (ShaderGraphDefinition.NodeDef nd : nodeDefs) {
            if (nd.getName() == null)
                throw new IllegalArgumentException("Node without a name, type " + nd.getType());
            if (!labels.add(nd.getName()))
                throw new IllegalArgumentException("Duplicate node name: " + nd.getName());
        }

        // 1. Instantiate nodes via iterative dependency resolution
        Map<String, Node> nodesByName = new LinkedHashMap<>(nodeDefs.size() * 2);
        Deque<ShaderGraphDefinition.NodeDef> pending = new ArrayDeque<>(nodeDefs);
        int prevPendingSize = -1;

        while (!pending.isEmpty()) {
            if (pending.size() == prevPendingSize) {
                String unresolved = pending.stream()
                        .map(ShaderGraphDefinition.NodeDef::getName)
                        .collect(Collectors.joining(", "));
                throw new IllegalStateException(
                        "Cycle or missing dependency detected. Unresolved nodes: " + unresolved);
            }
            prevPendingSize = pending.size();

            Iterator<ShaderGraphDefinition.NodeDef> iter = pending.iterator();
            while (iter.hasNext()) {
                ShaderGraphDefinition.NodeDef nd = iter.next();

                // Skip if any dependency hasn't been created yet
                if (nd.getInputs() != null && !nodesByName.keySet().containsAll(nd.getInputs().values()))
                    continue;

                nodesByName.put(nd.getName(), create(nd, nodesByName));
                iter.remove();
            }
        }

        // 2. Outputs
        Map<String, Node> outputs = new LinkedHashMap<>();
        if (info.getOutputs() != null) {
            for (Map.Entry<String, String> e : info.getOutputs().entrySet()) {
                Node root = nodesByName.get(e.getValue());
                if (root == null)
                    throw new IllegalArgumentException(
                            "Output " + e.getKey() + " refers to unknown node " + e.getValue());
                outputs.put(e.getKey(), root);
            }
        }

        CompileOptions options = info.getOptions() != null
                ? info.getOptions().toCompileOptions()
                : CompileOptions.defaults();

        log.info("Loaded shader graph '{}' ({} nodes, {} outputs)", info.getName(), nodesByName.size(),
                outputs.size());
        return new LoadedShaderGraph(info.getName(), info.getVersion(), options,
                Collections.unmodifiableMap(nodesByName), Collections.unmodifiableMap(outputs));
    }

    /** Loads, compiles and renders a definition with its own options. */
    public String compileToText(String json) {
        LoadedShaderGraph graph = load(json);
        return new ProgramCompiler(table, graph.options()).compileToText(graph.outputs());
    }

    private Node create(ShaderGraphDefinition.NodeDef nd, Map<String, Node> nodesByName) {
        Map<String, Object> props = nd.getProperties() != null ? nd.getProperties() : Map.of();
        Map<String, String> inputs = nd.getInputs() != null ? nd.getInputs() : Map.of();

        return switch (NodeType.fromString(nd.getType())) {
            case ATTRIBUTE -> variable(VariableKind.ATTRIBUTE, nd, props);
            case UNIFORM -> variable(VariableKind.UNIFORM, nd, props);
            case VARYING -> variable(VariableKind.VARYING, nd, props);
            case LITERAL -> literal(nd, props);
            case OPERATOR -> {
                Object op = props.get("op");
                if (op == null)
                    throw new IllegalArgumentException("Operator node " + nd.getName() + " missing 'op' property");
                List<Node> operands = new ArrayList<>(inputs.size());
                for (String key : orderedInputKeys(nd.getName(), inputs))
                    operands.add(nodesByName.get(inputs.get(key)));
                yield OperatorNode.create(checker, op.toString(), operands);
            }
            case CONDITIONAL -> ConditionalNode.create(
                    nodesByName.get(requireInput(nd, inputs, "cond")),
                    nodesByName.get(requireInput(nd, inputs, "then")),
                    nodesByName.get(requireInput(nd, inputs, "else")));
            case TEMPLATE -> throw new IllegalStateException("Unexpanded template node " + nd.getName());
        };
    }

    private static VariableNode variable(VariableKind kind, ShaderGraphDefinition.NodeDef nd,
            Map<String, Object> props) {
        Object type = props.get("glslType");
        if (type == null)
            throw new IllegalArgumentException(kind.qualifier() + " " + nd.getName() + " missing 'glslType'");
        String identifier = props.containsKey("identifier") ? props.get("identifier").toString() : nd.getName();
        Object precision = props.get("precision");
        return new VariableNode(kind, identifier, ShaderType.fromString(type.toString()),
                precision != null ? Precision.fromString(precision.toString()) : null);
    }

    /**
     * The scalar type comes from {@code glslType} when present, otherwise from
     * the JSON value: true/false, integral numbers and fractional numbers.
     */
    private static LiteralNode literal(ShaderGraphDefinition.NodeDef nd, Map<String, Object> props) {
        Object value = props.get("value");
        if (value == null)
            throw new IllegalArgumentException("Literal " + nd.getName() + " missing 'value'");
        Object declared = props.get("glslType");
        ShaderType type;
        if (declared != null)
            type = ShaderType.fromString(declared.toString());
        else if (value instanceof Boolean)
            type = ShaderType.BOOL;
        else if (value instanceof Integer || value instanceof Long || value instanceof BigInteger)
            type = ShaderType.INT;
        else
            type = ShaderType.FLOAT;

        return switch (type) {
            case BOOL -> LiteralNode.ofBool(value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString()));
            case INT -> LiteralNode.ofInt(intValue(nd.getName(), value));
            case FLOAT -> LiteralNode.ofFloat(
                    value instanceof Number n ? n.doubleValue() : Double.parseDouble(value.toString()));
            default -> throw new IllegalArgumentException("Literal " + nd.getName() + " must be scalar, got " + type);
        };
    }

    /** Exact 32-bit value of a JSON number or string; no truncation or wrap-around. */
    private static int intValue(String node, Object value) {
        try {
            if (value instanceof Number n)
                return new BigDecimal(n.toString()).intValueExact();
            return Integer.parseInt(value.toString().trim());
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Literal " + node + " is not a 32-bit int: " + value, e);
        }
    }

    /** Operator inputs are keyed {@code i0, i1, ...} and taken in numeric order. */
    static List<String> orderedInputKeys(String node, Map<String, String> inputs) {
        List<String> keys = new ArrayList<>(inputs.keySet());
        for (String key : keys) {
            if (!key.matches("i[0-9]+"))
                throw new IllegalArgumentException("Operator input key must be i<index>, got " + key + " in " + node);
        }
        keys.sort(Comparator.comparingInt(k -> Integer.parseInt(k.substring(1))));
        for (int i = 0; i < keys.size(); i++) {
            if (!keys.get(i).equals("i" + i))
                throw new IllegalArgumentException("Operator inputs of " + node + " must be i0..i"
                        + (keys.size() - 1) + ", got " + keys);
        }
        return keys;
    }

    private static String requireInput(ShaderGraphDefinition.NodeDef nd, Map<String, String> inputs, String key) {
        String label = inputs.get(key);
        if (label == null)
            throw new IllegalArgumentException("Conditional " + nd.getName() + " missing input '" + key + "'");
        return label;
    }

    /** Expands template nodes into their constituent sub-graph nodes. */
    private static List<ShaderGraphDefinition.NodeDef> expandTemplates(List<ShaderGraphDefinition.NodeDef> nodes,
            Map<String, ShaderGraphDefinition.TemplateDef> templates) {
        List<ShaderGraphDefinition.NodeDef> expanded = new ArrayList<>();
        Queue<ShaderGraphDefinition.NodeDef> queue = new ArrayDeque<>(nodes);
        int expansions = 0;

        while (!queue.isEmpty()) {
            ShaderGraphDefinition.NodeDef node = queue.poll();
            if (!NodeType.TEMPLATE.name().equalsIgnoreCase(node.getType())) {
                expanded.add(node);
                continue;
            }

            Map<String, Object> params = node.getProperties() != null ? node.getProperties() : Map.of();
            Object templateName = params.get("template");
            if (templateName == null)
                throw new IllegalArgumentException("Template node missing 'template' property: " + node.getName());
            ShaderGraphDefinition.TemplateDef template = templates.get(templateName.toString());
            if (template == null)
                throw new IllegalArgumentException("Unknown template: " + templateName);
            if (++expansions > 10_000)
                throw new IllegalStateException("Template expansion does not terminate at " + templateName);

            for (ShaderGraphDefinition.NodeDef tNode : template.getNodes()) {
                ShaderGraphDefinition.NodeDef newNode = new ShaderGraphDefinition.NodeDef();
                newNode.setName(substitute(tNode.getName(), params));
                newNode.setType(tNode.getType());
                newNode.setDescription(tNode.getDescription());
                if (tNode.getInputs() != null) {
                    Map<String, String> inputs = new LinkedHashMap<>();
                    tNode.getInputs().forEach((k, v) -> inputs.put(k, substitute(v, params)));
                    newNode.setInputs(inputs);
                }
                if (tNode.getProperties() != null) {
                    Map<String, Object> props = new LinkedHashMap<>();
                    tNode.getProperties().forEach(
                            (k, v) -> props.put(k, v instanceof String s ? substitute(s, params) : v));
                    newNode.setProperties(props);
                }
                queue.add(newNode); // nested templates are expanded in turn
            }
        }
        return expanded;
    }

    private static String substitute(String s, Map<String, Object> params) {
        if (s == null || !s.contains("{{"))
            return s;
        for (Map.Entry<String, Object> entry : params.entrySet())
            s = s.replace("{{" + entry.getKey() + "}}", String.valueOf(entry.getValue()));
        return s;
    }

    /**
     * A definition turned into nodes.
     *
     * @param nodesByName Every node by label.
     * @param outputs     Output name to root, in definition order.
     */
    public record LoadedShaderGraph(String name, String version, CompileOptions options,
            Map<String, Node> nodesByName, Map<String, Node> outputs) {

        public Node node(String label) {
            Node n = nodesByName.get(label);
            if (n == null)
                throw new IllegalArgumentException("Unknown node: " + label);
            return n;
        }

        /** Compiles the outputs with the definition's options. */
        public CompiledProgram compile(SignatureTable table) {
            return new ProgramCompiler(table, options).compile(outputs);
        }
    }
}
