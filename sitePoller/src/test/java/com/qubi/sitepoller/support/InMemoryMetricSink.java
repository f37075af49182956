package com.qubi.sitepoller.support;

import com.qubi.sitepoller.core.spi.MetricSink;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class InMemoryMetricSink implements MetricSink {
    private final Map<String, Double> values = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Set<String> known;   // null = acepta cualquier nombre

    public InMemoryMetricSink() { this(null); }
    public InMemoryMetricSink(Set<String> known) { this.known = known; }

    @Override
    public boolean publish(String name, double value) {
        if (known != null && !known.contains(name)) return false;
        values.put(name, value);
        return true;
    }

    public Map<String, Double> values() {
        synchronized (values) { return new LinkedHashMap<>(values); }
    }
}
