package com.qubi.sitepoller.core.model;

import java.util.Objects;
import java.util.Optional;

public record Device(
        String id,            // ej. "Solar", "Ups"
        String kind,          // tal cual viene del inventario ("scrape" | "query")
        String address        // ip o host, sin esquema
) {
    public Device {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(address, "address");
    }

    public Optional<DeviceKind> deviceKind() {
        return DeviceKind.parse(kind);
    }
}
