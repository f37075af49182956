package com.qubi.sitepoller.core.normalize;

import com.qubi.sitepoller.core.model.MetricNames;
import com.qubi.sitepoller.core.model.MetricSchema;
import com.qubi.sitepoller.core.model.RawFields;
import com.qubi.sitepoller.core.model.RawReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Convierte lecturas crudas en métricas canónicas {@code {site}_{metric}}.
 *
 * - posicionales (scrape): se aparean con {@link MetricSchema#suffixes()} por índice;
 *   si hay menos valores que sufijos, los sufijos sobrantes se pierden sin error.
 * - con nombre (query): el nombre ya viene del collector, sólo se prefija.
 *
 * Un valor sin número se descarta (nunca llega al sink). Al final se quitan las
 * claves del exclusion set.
 */
public class ReadingNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ReadingNormalizer.class);

    public Map<String, Double> normalize(String site, RawFields raw, MetricSchema schema, Set<String> exclusionSet) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (raw == null || raw.isEmpty()) return out;

        List<String> suffixes = schema.suffixes();
        for (RawReading r : raw.readings()) {
            String suffix;
            if (r.positional()) {
                if (r.index() >= suffixes.size()) continue;   // más valores que esquema
                suffix = suffixes.get(r.index());
            } else {
                suffix = r.name();
            }

            String name = MetricNames.canonical(site, suffix);
            OptionalDouble value = NumericExtractor.extract(r.value());
            if (value.isEmpty()) {
                log.debug("[normalize] {} has no numeric value in '{}', dropped", name, r.value());
                continue;
            }
            out.put(name, value.getAsDouble());
        }

        if (exclusionSet != null && !exclusionSet.isEmpty()) out.keySet().removeAll(exclusionSet);
        return out;
    }

    /** Variante con el exclusion set derivado del propio esquema. */
    public Map<String, Double> normalize(String site, RawFields raw, MetricSchema schema) {
        return normalize(site, raw, schema, schema.exclusionsFor(site));
    }
}
