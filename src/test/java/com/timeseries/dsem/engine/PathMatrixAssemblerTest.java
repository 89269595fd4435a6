package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.api.VariableSet;
import com.timeseries.dsem.dsl.SpecificationCompiler;
import com.timeseries.dsem.dsl.SpecificationCompiler.CompiledModel;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class PathMatrixAssemblerTest {

    private static PathMatrixAssembler assembler(CompiledModel m, SolverOptions opts) {
        return new PathMatrixAssembler(m.variables(), m.arrows(), m.parameters(), opts);
    }

    private static CompiledModel compile(List<String> vars, String text) {
        return new SpecificationCompiler(VariableSet.of(vars)).compileArrows(text);
    }

    @Test
    public void testSingleArrowScenario() {
        CompiledModel m = compile(List.of("x", "y"), "x -> y, 0, beta");
        PathMatrixSet set = assembler(m, SolverOptions.defaults()).assemble(new double[] { 0.5 });
        assertEquals(0, set.maxPathLag());
        double[][] a0 = set.pathArray(0);
        assertArrayEquals(new double[] { 0, 0 }, a0[0], 0.0);
        assertArrayEquals(new double[] { 0.5, 0 }, a0[1], 0.0);
    }

    @Test
    public void testLagsGetSeparateMatrices() {
        CompiledModel m = compile(List.of("x", "y"), "x -> y, 0, b0\nx -> y, 2, b2\ny -> y, 1, ar");
        PathMatrixSet set = assembler(m, SolverOptions.defaults()).assemble(new double[] { 0.1, 0.2, 0.3 });
        assertEquals(2, set.maxPathLag());
        assertEquals(0.1, set.path(0, "y", "x"), 0.0);
        assertEquals(0.3, set.path(1, "y", "y"), 0.0);
        assertEquals(0.2, set.path(2, "y", "x"), 0.0);
        assertEquals(0.0, set.path(2, "x", "y"), 0.0);
        // Beyond the highest lag reads as zero
        assertEquals(0.0, set.path(5, "y", "x"), 0.0);
        assertEquals(0.0, set.path(5).get(1, 0), 0.0);
    }

    @Test
    public void testFixedValueReproducedForAnyVector() {
        CompiledModel m = compile(List.of("x", "y"), "x -> y, 0, 0.75\ny -> y, 1, ar");
        PathMatrixAssembler asm = assembler(m, SolverOptions.defaults());
        for (double ar : new double[] { -3.0, 0.0, 0.4, 12.5 }) {
            PathMatrixSet set = asm.assemble(new double[] { ar });
            assertEquals(0.75, set.path(0, "y", "x"), 0.0);
            assertEquals(ar, set.path(1, "y", "y"), 0.0);
        }
    }

    @Test
    public void testSharedParameterSameValueInEveryCell() {
        CompiledModel m = compile(List.of("x", "y"), "x -> x, 1, ar\ny -> y, 1, ar\nx -> y, 1, cross");
        PathMatrixAssembler asm = assembler(m, SolverOptions.defaults());
        for (double v : new double[] { -0.9, 0.1, 0.55 }) {
            PathMatrixSet set = asm.assemble(new double[] { v, 0.01 });
            assertEquals(set.path(1, "x", "x"), set.path(1, "y", "y"), 0.0);
            assertEquals(v, set.path(1, "x", "x"), 0.0);
        }
    }

    @Test
    public void testCovarianceSymmetricAndVarianceFloor() {
        SolverOptions opts = new SolverOptions();
        opts.setVarianceFloor(0.001);
        CompiledModel m = compile(List.of("x", "y", "z"), "x <-> y, 0, rho\nz <-> z, 0, vz");
        PathMatrixSet set = assembler(m, opts).assemble(new double[] { 0.3, 2.0 });
        assertEquals(0.3, set.covariance(0, "x", "y"), 0.0);
        assertEquals(0.3, set.covariance(0, "y", "x"), 0.0);
        assertEquals(2.0, set.covariance(0, "z", "z"), 0.0);
        assertEquals(0.001, set.covariance(0, "x", "x"), 0.0);
        assertEquals(0.001, set.covariance(0, "y", "y"), 0.0);
    }

    @Test
    public void testExplicitZeroVarianceOverridesFloor() {
        CompiledModel m = compile(List.of("x", "y"), "x <-> x, 0, 0\nx -> y, 0, b");
        PathMatrixSet set = assembler(m, SolverOptions.defaults()).assemble(new double[] { 0.2 });
        assertEquals(0.0, set.covariance(0, "x", "x"), 0.0);
        assertEquals(1e-6, set.covariance(0, "y", "y"), 0.0);
    }

    @Test
    public void testLaggedCovariance() {
        CompiledModel m = compile(List.of("x", "y"), "x <-> y, 1, lagcov");
        PathMatrixSet set = assembler(m, SolverOptions.defaults()).assemble(new double[] { 0.4 });
        assertEquals(1, set.maxCovarianceLag());
        assertEquals(0.4, set.covariance(1, "x", "y"), 0.0);
        assertEquals(0.4, set.covariance(1, "y", "x"), 0.0);
        // Floor applies to lag 0 only
        assertEquals(0.0, set.covariance(1, "x", "x"), 0.0);
    }

    @Test
    public void testDuplicateArrowsAdd() {
        CompiledModel m = compile(List.of("x", "y"), "x -> y, 0, a\nx -> y, 0, b");
        PathMatrixSet set = assembler(m, SolverOptions.defaults()).assemble(new double[] { 0.2, 0.3 });
        assertEquals(0.5, set.path(0, "y", "x"), 1e-15);
    }

    @Test
    public void testAssemblyIsPure() {
        CompiledModel m = compile(List.of("x", "y"), "x -> y, 0, beta");
        PathMatrixAssembler asm = assembler(m, SolverOptions.defaults());
        PathMatrixSet first = asm.assemble(new double[] { 0.5 });
        first.path(0).set(1, 0, 99.0); // mutating a copy must not leak
        PathMatrixSet second = asm.assemble(new double[] { 0.5 });
        assertNotSame(first, second);
        assertEquals(0.5, first.path(0, "y", "x"), 0.0);
        assertArrayEquals(first.pathArray(0)[1], second.pathArray(0)[1], 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongVectorLengthRejected() {
        CompiledModel m = compile(List.of("x", "y"), "x -> y, 0, beta");
        assembler(m, SolverOptions.defaults()).assemble(new double[] { 0.5, 0.1 });
    }

    @Test
    public void testNonFiniteParameterRejected() {
        CompiledModel m = compile(List.of("x", "y"), "x -> y, 0, beta");
        try {
            assembler(m, SolverOptions.defaults()).assemble(new double[] { Double.NaN });
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("beta"));
        }
    }

    @Test
    public void testAssembleAtStart() {
        CompiledModel m = compile(List.of("x", "y"), "x -> y, 0, beta, 0.25");
        PathMatrixSet set = assembler(m, SolverOptions.defaults()).assembleAtStart();
        assertEquals(0.25, set.path(0, "y", "x"), 0.0);
    }
}
