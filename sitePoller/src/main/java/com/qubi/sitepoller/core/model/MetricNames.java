package com.qubi.sitepoller.core.model;

/**
 * Nombres canónicos {@code {site}_{metric}}, ej. "Pine_array_voltage". Los
 * valores viajan como entradas nombre -> double del normalizador.
 */
public final class MetricNames {
    private MetricNames(){}

    public static String canonical(String site, String suffix) {
        return site + "_" + suffix;
    }
}
