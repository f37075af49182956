package com.qubi.sitepoller.core.model;

import java.util.Locale;
import java.util.Optional;

public enum DeviceKind {
    SCRAPE,     // página renderizada en browser headless
    QUERY;      // SNMP GET sobre UDP

    /** Resuelve el kind declarado en el inventario; vacío si no es conocido. */
    public static Optional<DeviceKind> parse(String declared) {
        if (declared == null || declared.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(declared.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
