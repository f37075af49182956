package com.qubi.sitepoller.config;

import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.model.Inventory;
import com.qubi.sitepoller.core.model.MetricSchema;

import java.time.Duration;
import java.util.Map;

/** Config ya validada: el YAML crudo más el inventario y los esquemas derivados. */
public record LoadedConfig(
        AppConfig raw,
        Inventory inventory,
        Map<DeviceKind, MetricSchema> schemas
) {
    public LoadedConfig {
        schemas = Map.copyOf(schemas);
    }

    public Duration cadence() {
        return Duration.ofSeconds(raw.cadenceSeconds);
    }
}
