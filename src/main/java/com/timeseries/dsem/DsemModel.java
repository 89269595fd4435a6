package com.timeseries.dsem;

import com.timeseries.dsem.api.Arrow;
import com.timeseries.dsem.api.CompilationWarning;
import com.timeseries.dsem.api.ParameterTable;
import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.dsl.SpecificationCompiler.CompiledModel;
import com.timeseries.dsem.engine.BatchEvaluator;
import com.timeseries.dsem.engine.EffectSolver;
import com.timeseries.dsem.engine.EffectTable;
import com.timeseries.dsem.engine.PathMatrixAssembler;
import com.timeseries.dsem.engine.PathMatrixSet;
import com.timeseries.dsem.util.ModelExplain;

import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * A compiled model bundled with its assembler.
 *
 * <p>
 * This is the object an optimizer driver holds on to. It is immutable and
 * thread-safe; every call that takes a parameter vector builds fresh matrices.
 * <ul>
 * <li>{@link #assemble(double[])} maps a vector onto per-lag matrices.</li>
 * <li>{@link #solver(double[])} adds the reduced form and effect queries.</li>
 * <li>{@link #batchEvaluator()} evaluates many vectors in parallel.</li>
 * </ul>
 */
@Log4j2
public final class DsemModel {
    private final CompiledModel compiled;
    private final SolverOptions options;
    private final PathMatrixAssembler assembler;

    public DsemModel(CompiledModel compiled, SolverOptions options) {
        this.compiled = compiled;
        this.options = options;
        this.assembler = new PathMatrixAssembler(compiled.variables(), compiled.arrows(), compiled.parameters(),
                options);
        if (compiled.hasWarnings())
            log.info("Model compiled with {} warning(s)", compiled.warnings().size());
    }

    public CompiledModel compiled() {
        return compiled;
    }

    public SolverOptions options() {
        return options;
    }

    public VariableSet variables() {
        return compiled.variables();
    }

    public ParameterTable parameters() {
        return compiled.parameters();
    }

    public List<Arrow> arrows() {
        return compiled.arrows();
    }

    public List<CompilationWarning> warnings() {
        return compiled.warnings();
    }

    public double[] startValues() {
        return compiled.parameters().startValues();
    }

    public PathMatrixSet assemble(double[] parameters) {
        return assembler.assemble(parameters);
    }

    public EffectSolver solver(double[] parameters) {
        return new EffectSolver(assembler.assemble(parameters), options);
    }

    public double totalEffect(double[] parameters, String from, String to, int lag) {
        return solver(parameters).totalEffect(from, to, lag);
    }

    public EffectTable totalEffects(double[] parameters, int horizon) {
        return solver(parameters).totalEffects(horizon);
    }

    public EffectTable cumulativeEffects(double[] parameters, int horizon) {
        return solver(parameters).cumulativeEffects(horizon);
    }

    public EffectTable longRunEffects(double[] parameters) {
        return solver(parameters).longRunEffects();
    }

    /** A new evaluator; the caller owns it and must close it. */
    public BatchEvaluator batchEvaluator() {
        return new BatchEvaluator(assembler, options);
    }

    public ModelExplain explain() {
        return new ModelExplain(compiled);
    }
}
