package com.qubi.sitepoller.core.model;

import java.util.List;
import java.util.Objects;

public record Site(
        String id,            // prefijo de todas las métricas del sitio
        List<Device> devices  // en orden de inventario
) {
    public Site {
        Objects.requireNonNull(id, "id");
        devices = devices == null ? List.of() : List.copyOf(devices);
    }
}
