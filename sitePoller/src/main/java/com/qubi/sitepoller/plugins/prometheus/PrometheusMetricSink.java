package com.qubi.sitepoller.plugins.prometheus;

import com.qubi.sitepoller.core.spi.MetricSink;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** Único punto de escritura sobre el registry; Gauge.set ya es thread-safe. */
public class PrometheusMetricSink implements MetricSink {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricSink.class);

    private final MetricCatalog catalog;

    public PrometheusMetricSink(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public boolean publish(String name, double value) {
        Optional<Gauge> gauge = catalog.handle(name);
        if (gauge.isEmpty()) {
            log.warn("[sink] CONFIGURATION_ERROR metric {} is not in the catalog, skipped", name);
            return false;
        }
        gauge.get().set(value);
        return true;
    }
}
