package com.timeseries.dsem.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.timeseries.dsem.api.TotalEffect;
import com.timeseries.dsem.engine.EffectTable;

/**
 * Serializes effect tables as JSON arrays of
 * {@code {"from", "to", "lag", "value"}} rows for reporting layers. Long-run
 * rows carry {@code "lag": "long_run"}.
 */
public final class EffectTableJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EffectTableJson() {
    }

    public static ArrayNode toTree(EffectTable table) {
        ArrayNode rows = MAPPER.createArrayNode();
        for (TotalEffect e : table.rows()) {
            ObjectNode row = rows.addObject();
            row.put("from", e.from());
            row.put("to", e.to());
            if (e.isLongRun())
                row.put("lag", "long_run");
            else
                row.put("lag", e.lag());
            row.put("value", e.value());
        }
        return rows;
    }

    public static String toJson(EffectTable table) {
        try {
            return MAPPER.writeValueAsString(toTree(table));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize effect table", e);
        }
    }
}
