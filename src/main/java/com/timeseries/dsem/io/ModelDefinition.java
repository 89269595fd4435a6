package com.timeseries.dsem.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.timeseries.dsem.api.SolverOptions;

import lombok.Data;

/**
 * POJO representation of a model definition.
 *
 * <pre>
 * {
 *   "name": "isle_royale",
 *   "variables": ["wolves", "moose"],
 *   "notation": "arrow",
 *   "text": ["wolves -> wolves, 1, arW", "moose -> wolves, 1, MtoW"],
 *   "covariances": ["wolves, moose"],
 *   "options": { "varianceFloor": 1e-6 }
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ModelDefinition {
    private String name;
    private List<String> variables;
    /** {@code arrow} (default) or {@code equation}. */
    private String notation = "arrow";
    private List<String> text;
    private List<String> covariances;
    private SolverOptions options;

    /** Text lines joined into one block. */
    public String joinedText() {
        return text == null ? "" : String.join("\n", text);
    }
}
