package com.qubi.sitepoller.core.model;

public record RawReading(
        int index,            // posición dentro de la respuesta del collector
        String name,          // null si es posicional (scrape); nombre declarado si es query
        String value          // texto crudo, sin parsear
) {
    public boolean positional() {
        return name == null;
    }
}
