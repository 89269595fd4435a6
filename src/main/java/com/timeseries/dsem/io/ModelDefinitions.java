package com.timeseries.dsem.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.dsl.SpecificationCompiler;

import java.util.List;

/**
 * Reads JSON model definitions and compiles them.
 */
public final class ModelDefinitions {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ModelDefinitions() {
        // Utility class
    }

    /** Parses a JSON string into a ModelDefinition. */
    public static ModelDefinition parse(String json) {
        ModelDefinition def;
        try {
            def = MAPPER.readValue(json, ModelDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed model definition: " + e.getOriginalMessage(), e);
        }
        if (def == null)
            throw new IllegalArgumentException("Empty model definition");
        if (def.getVariables() == null || def.getVariables().isEmpty())
            throw new IllegalArgumentException("Model definition '" + def.getName() + "' declares no variables");
        return def;
    }

    /** Serializes a definition back to JSON. */
    public static String toJson(ModelDefinition def) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize model definition " + def.getName(), e);
        }
    }

    /** Options of {@code def}, or the defaults when it has none. */
    public static SolverOptions optionsOf(ModelDefinition def) {
        return def.getOptions() != null ? def.getOptions() : SolverOptions.defaults();
    }

    /** Compiles {@code def} using the notation it declares. */
    public static SpecificationCompiler.CompiledModel compile(ModelDefinition def) {
        var compiler = new SpecificationCompiler(VariableSet.of(def.getVariables()), optionsOf(def));
        var groups = def.getCovariances() != null ? def.getCovariances() : List.<String>of();
        return switch (Notation.fromString(def.getNotation())) {
            case ARROW -> compiler.compileArrows(def.joinedText(), groups);
            case EQUATION -> compiler.compileEquations(def.joinedText(), groups);
        };
    }
}
