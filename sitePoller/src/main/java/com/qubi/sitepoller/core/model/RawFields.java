package com.qubi.sitepoller.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resultado crudo de un intento de poll. Se descarta después de normalizar.
 */
public record RawFields(String site, String source, List<RawReading> readings) {

    public RawFields {
        readings = readings == null ? List.of() : List.copyOf(readings);
    }

    public static RawFields positional(String site, String source, List<String> values) {
        List<RawReading> out = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) out.add(new RawReading(i, null, values.get(i)));
        return new RawFields(site, source, out);
    }

    public static RawFields named(String site, String source, Map<String, String> values) {
        List<RawReading> out = new ArrayList<>(values.size());
        int i = 0;
        for (var e : values.entrySet()) out.add(new RawReading(i++, e.getKey(), e.getValue()));
        return new RawFields(site, source, out);
    }

    public int size() { return readings.size(); }
    public boolean isEmpty() { return readings.isEmpty(); }
}
