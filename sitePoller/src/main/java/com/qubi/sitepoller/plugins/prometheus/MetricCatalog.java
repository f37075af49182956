package com.qubi.sitepoller.plugins.prometheus;

import com.qubi.sitepoller.config.ConfigurationException;
import com.qubi.sitepoller.core.model.Device;
import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.model.Inventory;
import com.qubi.sitepoller.core.model.MetricNames;
import com.qubi.sitepoller.core.model.MetricSchema;
import com.qubi.sitepoller.core.model.Site;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Nombre canónico -> gauge registrado. Se arma una sola vez antes del primer
 * ciclo, con todos los nombres que el inventario puede producir; después es
 * sólo lectura.
 */
public class MetricCatalog {

    private static final Logger log = LoggerFactory.getLogger(MetricCatalog.class);

    private final Map<String, Gauge> gauges;

    private MetricCatalog(Map<String, Gauge> gauges) {
        this.gauges = Collections.unmodifiableMap(gauges);
    }

    public static MetricCatalog register(CollectorRegistry registry, Inventory inventory,
                                         Map<DeviceKind, MetricSchema> schemas) {
        Map<String, Gauge> out = new LinkedHashMap<>();
        for (Site site : inventory.sites()) {
            for (Device device : site.devices()) {
                Optional<DeviceKind> kind = device.deviceKind();
                if (kind.isEmpty() || !schemas.containsKey(kind.get())) continue;
                for (String suffix : schemas.get(kind.get()).publishedSuffixes()) {
                    String name = MetricNames.canonical(site.id(), suffix);
                    if (out.containsKey(name))
                        throw new ConfigurationException("Metric " + name + " registered twice");
                    try {
                        out.put(name, Gauge.build()
                                .name(name)
                                .help(suffix.replace('_', ' ') + " at " + site.id() + " (" + device.id() + ")")
                                .register(registry));
                    } catch (IllegalArgumentException e) {
                        // nombre inválido o ya existente en el registry
                        throw new ConfigurationException("Cannot register metric " + name + ": " + e.getMessage(), e);
                    }
                }
            }
        }
        log.info("[catalog] registered {} gauges", out.size());
        return new MetricCatalog(out);
    }

    public Optional<Gauge> handle(String name) {
        return Optional.ofNullable(gauges.get(name));
    }

    public Set<String> names() {
        return gauges.keySet();
    }

    public int size() {
        return gauges.size();
    }
}
