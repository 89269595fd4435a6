package com.timeseries.dsem;

import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.dsl.SpecificationCompiler;
import com.timeseries.dsem.io.ModelDefinition;
import com.timeseries.dsem.io.ModelDefinitions;

import java.util.List;

/**
 * Dynamic structural equation models: specification compiler and path algebra.
 *
 * <h2>Pipeline</h2>
 * <p>
 * text &rarr; arrow records &rarr; parameter table &rarr; per-lag matrices
 * (for a given parameter vector) &rarr; total effects.
 *
 * <pre>
 * DsemModel m = Dsem.fromArrows(List.of("x", "y"), "x -> y, 0, beta");
 * double effect = m.totalEffect(new double[] { 0.5 }, "x", "y", 0); // 0.5
 * </pre>
 *
 * Estimation, likelihoods and plotting live outside this library; they
 * consume the parameter vector contract defined by
 * {@link com.timeseries.dsem.api.ParameterTable}.
 */
public final class Dsem {

    private Dsem() {
        // Prevent instantiation of utility class
    }

    public static DsemModel fromArrows(List<String> variables, String text) {
        return fromArrows(variables, text, List.of(), SolverOptions.defaults());
    }

    public static DsemModel fromArrows(List<String> variables, String text, List<String> covarianceGroups,
            SolverOptions options) {
        var compiler = new SpecificationCompiler(VariableSet.of(variables), options);
        return new DsemModel(compiler.compileArrows(text, covarianceGroups), options);
    }

    public static DsemModel fromEquations(List<String> variables, String text) {
        return fromEquations(variables, text, List.of(), SolverOptions.defaults());
    }

    public static DsemModel fromEquations(List<String> variables, String text, List<String> covarianceGroups,
            SolverOptions options) {
        var compiler = new SpecificationCompiler(VariableSet.of(variables), options);
        return new DsemModel(compiler.compileEquations(text, covarianceGroups), options);
    }

    /** Compiles a JSON model definition. */
    public static DsemModel fromJson(String json) {
        ModelDefinition def = ModelDefinitions.parse(json);
        return new DsemModel(ModelDefinitions.compile(def), ModelDefinitions.optionsOf(def));
    }
}
