package com.shading.sgc.io;

import com.shading.sgc.api.Precision;
import com.shading.sgc.config.CompileOptions;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a shader graph definition.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ShaderGraphDefinition {
    private ShaderInfo shader;

    /** Meta-information, nodes and outputs of one shader. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ShaderInfo {
        private String name, version;
        private OptionsDef options;
        private List<TemplateDef> templates;
        private List<NodeDef> nodes;
        /** Output name to node label, in emission order. */
        private Map<String, String> outputs;
    }

    /** Definition of a reusable sub-graph template. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TemplateDef {
        private String name;
        private List<NodeDef> nodes;
    }

    /** Definition of a single node in the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description;
        private Map<String, String> inputs;
        private Map<String, Object> properties;
    }

    /** Emission settings; absent fields keep their defaults. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class OptionsDef {
        @JsonProperty("version")
        private String versionDirective;
        private String precision;
        private String temporaryPrefix;
        private String defaultOutput;
        private String indent;

        public CompileOptions toCompileOptions() {
            CompileOptions o = CompileOptions.defaults();
            if (versionDirective != null)
                o = o.withVersionDirective(versionDirective);
            if (precision != null)
                o = o.withFloatPrecision(Precision.fromString(precision));
            if (temporaryPrefix != null)
                o = o.withTemporaryPrefix(temporaryPrefix);
            if (defaultOutput != null)
                o = o.withDefaultOutput(defaultOutput);
            if (indent != null)
                o = o.withIndent(indent);
            return o;
        }
    }
}
