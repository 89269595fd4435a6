package com.timeseries.dsem.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.timeseries.dsem.Dsem;
import com.timeseries.dsem.DsemModel;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class EffectTableJsonTest {

    private final DsemModel model = Dsem.fromArrows(List.of("x"), "x -> x, 1, rho");

    @Test
    public void testLaggedRows() throws Exception {
        String json = EffectTableJson.toJson(model.totalEffects(new double[] { 0.5 }, 1));
        JsonNode rows = new ObjectMapper().readTree(json);
        assertEquals(2, rows.size());
        JsonNode second = rows.get(1);
        assertEquals("x", second.get("from").asText());
        assertEquals("x", second.get("to").asText());
        assertEquals(1, second.get("lag").asInt());
        assertEquals(0.5, second.get("value").asDouble(), 0.0);
    }

    @Test
    public void testLongRunLabel() {
        ArrayNode rows = EffectTableJson.toTree(model.longRunEffects(new double[] { 0.5 }));
        assertEquals(1, rows.size());
        assertEquals("long_run", rows.get(0).get("lag").asText());
        assertEquals(2.0, rows.get(0).get("value").asDouble(), 1e-12);
    }
}
