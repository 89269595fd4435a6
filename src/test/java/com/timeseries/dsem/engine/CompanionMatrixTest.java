package com.timeseries.dsem.engine;

import org.ejml.data.DMatrixRMaj;
import org.junit.Test;

import static org.junit.Assert.*;

public class CompanionMatrixTest {

    @Test
    public void testLayout() {
        DMatrixRMaj phi1 = new DMatrixRMaj(new double[][] { { 0.1, 0.2 }, { 0.3, 0.4 } });
        DMatrixRMaj phi2 = new DMatrixRMaj(new double[][] { { 0.5, 0.6 }, { 0.7, 0.8 } });
        CompanionMatrix c = new CompanionMatrix(new DMatrixRMaj[] { phi1, phi2 });
        assertEquals(2, c.order());
        assertEquals(4, c.dimension());

        DMatrixRMaj f = c.matrix();
        assertEquals(0.2, f.get(0, 1), 0.0);
        assertEquals(0.6, f.get(0, 3), 0.0);
        assertEquals(0.7, f.get(1, 2), 0.0);
        assertEquals(1.0, f.get(2, 0), 0.0);
        assertEquals(1.0, f.get(3, 1), 0.0);
        assertEquals(0.0, f.get(2, 2), 0.0);
    }

    @Test
    public void testPowerMatchesRepeatedMultiplication() {
        DMatrixRMaj phi1 = new DMatrixRMaj(new double[][] { { 0.6, -0.3 }, { 0.2, 0.8 } });
        CompanionMatrix c = new CompanionMatrix(new DMatrixRMaj[] { phi1 });
        DMatrixRMaj state = new DMatrixRMaj(new double[][] { { 1, 0 }, { 0, 1 } });
        for (int d = 1; d <= 5; d++) {
            state = c.step(state);
            DMatrixRMaj p = c.power(d);
            for (int i = 0; i < 4; i++)
                assertEquals(state.get(i), p.get(i), 1e-14);
        }
        DMatrixRMaj p0 = c.power(0);
        assertEquals(1.0, p0.get(0, 0), 0.0);
        assertEquals(0.0, p0.get(0, 1), 0.0);
    }

    @Test
    public void testTwoStepPathSum() {
        // Lag-2 block = Phi1^2 + Phi2
        DMatrixRMaj phi1 = new DMatrixRMaj(new double[][] { { 0.3 } });
        DMatrixRMaj phi2 = new DMatrixRMaj(new double[][] { { 0.2 } });
        CompanionMatrix c = new CompanionMatrix(new DMatrixRMaj[] { phi1, phi2 });
        assertEquals(0.29, c.leadingBlockOfPower(2).get(0, 0), 1e-15);
    }

    @Test
    public void testSpectralRadiusComplexEigenvalues() {
        // Rotation scaled by 0.9: eigenvalues 0.9 * e^{+-i theta}
        double r = 0.9, th = 0.7;
        DMatrixRMaj phi1 = new DMatrixRMaj(new double[][] {
                { r * Math.cos(th), -r * Math.sin(th) },
                { r * Math.sin(th), r * Math.cos(th) } });
        assertEquals(0.9, new CompanionMatrix(new DMatrixRMaj[] { phi1 }).spectralRadius(), 1e-10);
    }

    @Test
    public void testGeometricSeries() {
        DMatrixRMaj phi1 = new DMatrixRMaj(new double[][] { { 0.5 } });
        assertEquals(2.0, new CompanionMatrix(new DMatrixRMaj[] { phi1 }).geometricSeriesLeadingBlock().get(0, 0),
                1e-14);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyFamilyRejected() {
        new CompanionMatrix(new DMatrixRMaj[0]);
    }
}
