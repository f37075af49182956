package com.qubi.sitepoller.core.model;

import java.util.List;

/** Roster de sitios y devices; no cambia durante la corrida. */
public record Inventory(List<Site> sites) {
    public Inventory {
        sites = sites == null ? List.of() : List.copyOf(sites);
    }

    public int deviceCount() {
        return sites.stream().mapToInt(s -> s.devices().size()).sum();
    }
}
