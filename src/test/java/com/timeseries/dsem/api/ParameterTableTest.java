package com.timeseries.dsem.api;

import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ParameterTableTest {

    private static ParameterTable table() {
        ParameterTable.Builder b = ParameterTable.builder();
        b.declare("beta", ArrowKind.PATH, 0.01, 1);
        b.declare("sigma", ArrowKind.COVARIANCE, 1.0, 2);
        assertEquals(0, b.declare("beta", ArrowKind.PATH, 5.0, 3));
        return b.build();
    }

    @Test
    public void testFirstDeclarationWins() {
        ParameterTable t = table();
        assertEquals(2, t.size());
        assertEquals(List.of("beta", "sigma"), t.names());
        assertEquals(0.01, t.parameter(0).startValue(), 0.0);
        assertEquals(1, t.parameter(0).lineNumber());
        assertEquals(ArrowKind.COVARIANCE, t.parameter(1).kind());
        assertEquals(-1, t.indexOf("gamma"));
    }

    @Test
    public void testStartValuesAreCopies() {
        ParameterTable t = table();
        double[] v = t.startValues();
        v[0] = 42;
        assertArrayEquals(new double[] { 0.01, 1.0 }, t.startValues(), 0.0);
    }

    @Test
    public void testVectorOfAndNamesOf() {
        ParameterTable t = table();
        double[] v = t.vectorOf(Map.of("sigma", 2.5));
        assertArrayEquals(new double[] { 0.01, 2.5 }, v, 0.0);
        Map<String, Double> named = t.namesOf(new double[] { 0.3, 0.4 });
        assertEquals(List.of("beta", "sigma"), List.copyOf(named.keySet()));
        assertEquals(0.4, named.get("sigma"), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testVectorOfUnknownName() {
        table().vectorOf(Map.of("gamma", 1.0));
    }

    @Test
    public void testVectorOfNullValue() {
        Map<String, Double> values = new HashMap<>();
        values.put("beta", null);
        try {
            table().vectorOf(values);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("beta"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLengthMismatch() {
        table().requireLength(new double[3]);
    }
}
