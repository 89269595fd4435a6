package com.timeseries.dsem.engine;

import com.timeseries.dsem.api.TotalEffect;
import com.timeseries.dsem.api.VariableSet;
import org.ejml.data.DMatrixRMaj;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class EffectTableTest {

    private static EffectTable table() {
        VariableSet vars = VariableSet.of("x", "y");
        DMatrixRMaj psi0 = new DMatrixRMaj(new double[][] { { 1.0, 0.0 }, { 0.5, 1.0 } });
        DMatrixRMaj psi1 = new DMatrixRMaj(new double[][] { { 0.0, 0.0 }, { 0.25, 0.5 } });
        return EffectTable.builder(vars).addMatrix(0, psi0).addMatrix(1, psi1).build();
    }

    @Test
    public void testRowOrderIsLagThenResponseThenPredictor() {
        List<TotalEffect> rows = table().rows();
        assertEquals(8, rows.size());
        assertEquals(new TotalEffect("x", "x", 0, 1.0), rows.get(0));
        assertEquals(new TotalEffect("y", "x", 0, 0.0), rows.get(1));
        assertEquals(new TotalEffect("x", "y", 0, 0.5), rows.get(2));
        assertEquals(new TotalEffect("x", "y", 1, 0.25), rows.get(6));
    }

    @Test
    public void testLookups() {
        EffectTable t = table();
        assertEquals(0.5, t.value("y", "y", 1), 0.0);
        assertTrue(t.contains("x", "y", 1));
        assertFalse(t.contains("x", "y", 2));
        assertEquals(4, t.forLag(1).size());
        assertEquals(5, t.nonZero().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRowRejected() {
        table().value("x", "y", 3);
    }
}
