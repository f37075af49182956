package com.qubi.sitepoller.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Esquema de un kind de device: sufijos de métrica en orden posicional y
 * los sufijos que se descartan después de normalizar (códigos de estado discretos).
 */
public record MetricSchema(
        DeviceKind kind,
        List<String> suffixes,
        Set<String> excluded
) {
    public MetricSchema {
        Objects.requireNonNull(kind, "kind");
        suffixes = suffixes == null ? List.of() : List.copyOf(suffixes);
        excluded = excluded == null ? Set.of() : Set.copyOf(excluded);
    }

    /** Nombres con prefijo de sitio que nunca se publican. */
    public Set<String> exclusionsFor(String site) {
        Set<String> out = new LinkedHashSet<>();
        for (String suffix : excluded) out.add(MetricNames.canonical(site, suffix));
        return out;
    }

    /** Sufijos que sí llegan al registry, en orden. */
    public List<String> publishedSuffixes() {
        return suffixes.stream().filter(s -> !excluded.contains(s)).toList();
    }
}
