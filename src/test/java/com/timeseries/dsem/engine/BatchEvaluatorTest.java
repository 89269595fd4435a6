package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.dsl.SpecificationCompiler;
import com.timeseries.dsem.dsl.SpecificationCompiler.CompiledModel;
import com.timeseries.dsem.engine.BatchEvaluator.Evaluation;
import com.timeseries.dsem.error.NonIdentifiableStructureException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class BatchEvaluatorTest {

    private static PathMatrixAssembler feedbackAssembler(SolverOptions opts) {
        CompiledModel m = new SpecificationCompiler(VariableSet.of("x", "y"), opts)
                .compileArrows("y -> x, 0, a\nx -> y, 0, b");
        return new PathMatrixAssembler(m.variables(), m.arrows(), m.parameters(), opts);
    }

    @Test
    public void testResultsInInputOrderWithIsolatedFailures() {
        SolverOptions opts = new SolverOptions();
        opts.setParallelism(3);
        List<double[]> vectors = List.of(
                new double[] { 0.5, 0.4 },
                new double[] { 2.0, 0.5 },
                new double[] { 0.1 },
                new double[] { 0.0, 0.3 });

        try (BatchEvaluator batch = new BatchEvaluator(feedbackAssembler(opts), opts)) {
            List<Evaluation> out = batch.totalEffects(vectors, 0);
            assertEquals(4, out.size());
            for (int i = 0; i < 4; i++)
                assertEquals(i, out.get(i).index());

            assertTrue(out.get(0).succeeded());
            assertEquals(0.4 / (1 - 0.2), out.get(0).effects().value("x", "y", 0), 1e-12);

            assertFalse(out.get(1).succeeded());
            assertTrue(out.get(1).error() instanceof NonIdentifiableStructureException);
            assertNull(out.get(1).effects());

            assertFalse(out.get(2).succeeded());
            assertTrue(out.get(2).error() instanceof IllegalArgumentException);

            assertTrue(out.get(3).succeeded());
            assertEquals(0.3, out.get(3).effects().value("x", "y", 0), 1e-12);
        }
    }

    @Test
    public void testMatchesSequentialEvaluation() {
        SolverOptions opts = new SolverOptions();
        opts.setParallelism(4);
        PathMatrixAssembler asm = feedbackAssembler(opts);
        List<double[]> vectors = new ArrayList<>();
        for (int i = 0; i < 50; i++)
            vectors.add(new double[] { 0.01 * i, -0.02 * i });

        try (BatchEvaluator batch = new BatchEvaluator(asm, opts)) {
            List<Evaluation> out = batch.evaluate(vectors, EffectSolver::longRunEffects);
            for (int i = 0; i < vectors.size(); i++) {
                EffectTable expected = new EffectSolver(asm.assemble(vectors.get(i)), opts).longRunEffects();
                assertEquals(expected.rows(), out.get(i).effects().rows());
            }
        }
    }

    @Test
    public void testCallerVectorIsCopied() {
        SolverOptions opts = new SolverOptions();
        opts.setParallelism(1);
        double[] theta = { 0.5, 0.4 };
        try (BatchEvaluator batch = new BatchEvaluator(feedbackAssembler(opts), opts)) {
            Evaluation e = batch.totalEffects(List.of(theta), 0).get(0);
            theta[0] = 9.0;
            assertEquals(0.5, e.parameters()[0], 0.0);
        }
    }
}
