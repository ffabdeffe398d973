package com.modeling.dae.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.Data;

/**
 * POJO representation of a class table document.
 * Equation and expression trees stay as raw {@link JsonNode}s here and are
 * decoded by {@link AstJsonCodec}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ClassTableDefinition {
    private String name, version;
    private List<ClassDef> classes;

    /** One class declaration. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ClassDef {
        private String name, type, description;
        private boolean partial, encapsulated;
        @JsonProperty("extends")
        private List<String> extendsClauses;
        private List<ComponentDef> components;
        private List<JsonNode> equations;
        @JsonProperty("initial_equations")
        private List<JsonNode> initialEquations;
        private List<List<JsonNode>> algorithms;
        @JsonProperty("initial_algorithms")
        private List<List<JsonNode>> initialAlgorithms;
    }

    /** One component declaration. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ComponentDef {
        private String name, type, variability, causality, connection, description;
        private JsonNode start;
        private List<JsonNode> shape;
    }
}
