package com.timeseries.dsem;

import com.timeseries.dsem.api.SolverOptions;
import com.timeseries.dsem.engine.BatchEvaluator;
import com.timeseries.dsem.engine.PathMatrixSet;
import com.timeseries.dsem.error.DivergentSeriesException;
import com.timeseries.dsem.error.UnknownVariableException;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class DsemTest {

    @Test
    public void testQuickStart() {
        DsemModel m = Dsem.fromArrows(List.of("x", "y"), "x -> y, 0, beta");
        assertEquals(0.5, m.totalEffect(new double[] { 0.5 }, "x", "y", 0), 0.0);
        assertArrayEquals(new double[] { 0.01 }, m.startValues(), 0.0);
        assertFalse(m.compiled().hasWarnings());
    }

    @Test
    public void testArrowAndEquationNotationsAgree() {
        List<String> vars = List.of("x", "y", "z");
        DsemModel arrows = Dsem.fromArrows(vars, "x -> y, 0, a\ny -> y, 1, r\ny -> z, 0, c\nx -> z, 2, d");
        DsemModel equations = Dsem.fromEquations(vars, "y = a*x + r*lag[y, 1]\nz = c*y + d*lag[x, 2]");
        assertEquals(arrows.parameters().names(), equations.parameters().names());

        double[] theta = { 0.4, 0.6, -0.5, 0.2 };
        assertEquals(arrows.totalEffects(theta, 5).rows(), equations.totalEffects(theta, 5).rows());
    }

    @Test
    public void testCovarianceGroupsAndFloor() {
        SolverOptions opts = new SolverOptions();
        opts.setVarianceFloor(1e-3);
        DsemModel m = Dsem.fromArrows(List.of("x", "y", "z"), "x -> y, 0, b\nx <-> x, 0, vx, 2.0",
                List.of("x, y"), opts);
        assertEquals(List.of("b", "vx", "C[x,y]", "V[y]"), m.parameters().names());
        assertArrayEquals(new double[] { 0.01, 2.0, 0.0, 1.0 }, m.startValues(), 0.0);

        PathMatrixSet s = m.assemble(new double[] { 0.3, 2.0, 0.25, 1.5 });
        assertEquals(2.0, s.covariance(0, "x", "x"), 0.0);
        assertEquals(0.25, s.covariance(0, "y", "x"), 0.0);
        assertEquals(0.25, s.covariance(0, "x", "y"), 0.0);
        assertEquals(1.5, s.covariance(0, "y", "y"), 0.0);
        assertEquals(1e-3, s.covariance(0, "z", "z"), 0.0);
    }

    @Test
    public void testWarmStartFromNamedEstimates() {
        DsemModel m = Dsem.fromArrows(List.of("x", "y"), "x -> y, 0, b\ny -> y, 1, ar");
        double[] theta = m.parameters().vectorOf(Map.of("ar", 0.5, "b", 0.5));
        assertEquals(0.25, m.totalEffect(theta, "x", "y", 1), 1e-12);
        assertEquals(1.0, m.longRunEffects(theta).value("x", "y", -1), 1e-12);
        assertEquals(0.875, m.cumulativeEffects(theta, 2).value("x", "y", 2), 1e-12);
    }

    @Test
    public void testDivergentFallsBackToCumulative() {
        DsemModel m = Dsem.fromArrows(List.of("x"), "x -> x, 1, rho");
        double[] theta = { 1.2 };
        try {
            m.longRunEffects(theta);
            fail("Expected DivergentSeriesException");
        } catch (DivergentSeriesException e) {
            assertEquals(1.2, e.spectralRadius(), 1e-12);
        }
        assertEquals(1 + 1.2 + 1.44, m.cumulativeEffects(theta, 2).value("x", "x", 2), 1e-12);
    }

    @Test
    public void testFromJson() {
        String json = """
                {
                  "name": "chain",
                  "variables": ["x", "m", "y"],
                  "notation": "equation",
                  "text": ["m = a*x", "y = b*m + c*x"]
                }
                """;
        DsemModel m = Dsem.fromJson(json);
        assertEquals(0.5 * 0.4 + 0.1, m.totalEffect(new double[] { 0.5, 0.4, 0.1 }, "x", "y", 0), 1e-12);
    }

    @Test
    public void testBatchEvaluator() {
        DsemModel m = Dsem.fromArrows(List.of("x"), "x -> x, 1, rho");
        try (BatchEvaluator batch = m.batchEvaluator()) {
            var out = batch.evaluate(List.of(new double[] { 0.5 }, new double[] { 1.5 }),
                    solver -> solver.longRunEffects());
            assertEquals(2.0, out.get(0).effects().value("x", "x", -1), 1e-12);
            assertTrue(out.get(1).error() instanceof DivergentSeriesException);
        }
    }

    @Test(expected = UnknownVariableException.class)
    public void testUnknownVariableAtCompile() {
        Dsem.fromArrows(List.of("x", "y"), "x -> w, 0, b");
    }
}
