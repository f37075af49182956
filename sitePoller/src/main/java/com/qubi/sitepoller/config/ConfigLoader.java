package com.qubi.sitepoller.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.qubi.sitepoller.core.model.Device;
import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.model.Inventory;
import com.qubi.sitepoller.core.model.MetricNames;
import com.qubi.sitepoller.core.model.MetricSchema;
import com.qubi.sitepoller.core.model.Site;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lee el YAML de configuración y arma el inventario y los esquemas por kind.
 * Todo lo que se puede validar antes del primer ciclo se valida acá.
 */
public final class ConfigLoader {
    private ConfigLoader(){}

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "sitepoller.yaml";

    // Prometheus: [a-zA-Z_:][a-zA-Z0-9_:]*
    private static final Pattern SITE_ID = Pattern.compile("[a-zA-Z_:][a-zA-Z0-9_:]*");
    private static final Pattern SUFFIX = Pattern.compile("[a-zA-Z0-9_:]+");
    private static final Pattern OID = Pattern.compile("\\d+(\\.\\d+)+");

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    /** Sin path usa el recurso {@value #DEFAULT_RESOURCE} del classpath. */
    public static LoadedConfig load(String path) {
        if (path == null || path.isBlank()) {
            try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) throw new ConfigurationException("Missing classpath resource " + DEFAULT_RESOURCE);
                log.info("[config] loading classpath:{}", DEFAULT_RESOURCE);
                return load(in);
            } catch (IOException e) {
                throw new ConfigurationException("Error reading classpath resource " + DEFAULT_RESOURCE, e);
            }
        }
        Path file = Path.of(path);
        try (InputStream in = Files.newInputStream(file)) {
            log.info("[config] loading {}", file.toAbsolutePath());
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading config file " + file, e);
        }
    }

    public static LoadedConfig load(InputStream yaml) {
        AppConfig cfg;
        try {
            cfg = YAML.readValue(yaml, AppConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Error parsing configuration: " + e.getMessage(), e);
        }
        if (cfg == null) throw new ConfigurationException("Empty configuration");
        return build(cfg);
    }

    public static LoadedConfig build(AppConfig cfg) {
        if (cfg.cadenceSeconds < 0) throw new ConfigurationException("cadenceSeconds must be >= 0");
        if (cfg.exposition == null) cfg.exposition = new AppConfig.ExpositionConfig();
        if (cfg.scrape == null) cfg.scrape = new AppConfig.ScrapeConfig();
        if (cfg.query == null) cfg.query = new AppConfig.QueryConfig();

        Inventory inventory = inventory(cfg);
        Map<DeviceKind, MetricSchema> schemas = schemas(cfg);
        checkSchemasPresent(inventory, schemas);
        checkUniqueNames(inventory, schemas);

        log.info("[config] {} sites, {} devices, cadence={}s",
                inventory.sites().size(), inventory.deviceCount(), cfg.cadenceSeconds);
        return new LoadedConfig(cfg, inventory, schemas);
    }

    static Inventory inventory(AppConfig cfg) {
        List<Site> sites = new ArrayList<>();
        if (cfg.sites == null || cfg.sites.isEmpty()) {
            log.warn("[config] inventory has no sites");
            return new Inventory(sites);
        }
        for (var siteEntry : cfg.sites.entrySet()) {
            String siteId = siteEntry.getKey();
            if (!SITE_ID.matcher(siteId).matches())
                throw new ConfigurationException("Invalid site id '" + siteId + "': must match " + SITE_ID.pattern());

            List<Device> devices = new ArrayList<>();
            if (siteEntry.getValue() != null) {
                for (var devEntry : siteEntry.getValue().entrySet()) {
                    AppConfig.DeviceConfig dc = devEntry.getValue();
                    if (dc == null || dc.address == null || dc.address.isBlank())
                        throw new ConfigurationException("Device " + siteId + "/" + devEntry.getKey() + " has no address");
                    Device d = new Device(devEntry.getKey(), dc.kind, dc.address.trim());
                    // kind desconocido no aborta: el scheduler lo reporta y lo saltea en cada ciclo
                    if (d.deviceKind().isEmpty())
                        log.warn("[config] device {}/{} declares unknown kind '{}'", siteId, d.id(), dc.kind);
                    devices.add(d);
                }
            }
            sites.add(new Site(siteId, devices));
        }
        return new Inventory(sites);
    }

    static Map<DeviceKind, MetricSchema> schemas(AppConfig cfg) {
        Map<DeviceKind, MetricSchema> out = new EnumMap<>(DeviceKind.class);

        List<String> scrapeSuffixes = cfg.scrape.schema == null ? List.of() : cfg.scrape.schema;
        checkSuffixes(DeviceKind.SCRAPE, scrapeSuffixes, cfg.scrape.exclude);
        out.put(DeviceKind.SCRAPE, new MetricSchema(DeviceKind.SCRAPE, scrapeSuffixes, asSet(cfg.scrape.exclude)));

        List<String> queryNames = new ArrayList<>();
        if (cfg.query.objects != null) {
            for (var o : cfg.query.objects) {
                if (o == null || o.name == null || o.oid == null)
                    throw new ConfigurationException("query.objects entries need name and oid");
                if (!OID.matcher(o.oid.trim()).matches())
                    throw new ConfigurationException("Invalid OID '" + o.oid + "' for " + o.name);
                queryNames.add(o.name);
            }
        }
        checkSuffixes(DeviceKind.QUERY, queryNames, cfg.query.exclude);
        out.put(DeviceKind.QUERY, new MetricSchema(DeviceKind.QUERY, queryNames, asSet(cfg.query.exclude)));
        return out;
    }

    private static void checkSuffixes(DeviceKind kind, List<String> suffixes, List<String> exclude) {
        Set<String> seen = new HashSet<>();
        for (String s : suffixes) {
            if (s == null || !SUFFIX.matcher(s).matches())
                throw new ConfigurationException("Invalid metric suffix '" + s + "' in " + kind + " schema");
            if (!seen.add(s))
                throw new ConfigurationException("Duplicate metric suffix '" + s + "' in " + kind + " schema");
        }
        if (exclude != null) {
            for (String x : exclude) {
                if (!seen.contains(x)) log.warn("[config] {} exclude '{}' is not in the schema", kind, x);
            }
        }
    }

    private static void checkSchemasPresent(Inventory inventory, Map<DeviceKind, MetricSchema> schemas) {
        for (Site site : inventory.sites()) {
            for (Device d : site.devices()) {
                d.deviceKind().ifPresent(kind -> {
                    if (schemas.get(kind).suffixes().isEmpty())
                        throw new ConfigurationException("Device " + site.id() + "/" + d.id()
                                + " is " + kind + " but the " + kind + " schema is empty");
                });
            }
        }
    }

    // dos devices del mismo sitio y kind publicarían los mismos nombres
    private static void checkUniqueNames(Inventory inventory, Map<DeviceKind, MetricSchema> schemas) {
        for (Site site : inventory.sites()) {
            Set<String> names = new HashSet<>();
            for (Device d : site.devices()) {
                var kind = d.deviceKind();
                if (kind.isEmpty()) continue;
                for (String suffix : schemas.get(kind.get()).publishedSuffixes()) {
                    String name = MetricNames.canonical(site.id(), suffix);
                    if (!names.add(name))
                        throw new ConfigurationException("Metric name " + name + " produced twice at site " + site.id()
                                + " (device " + d.id() + ")");
                }
            }
        }
    }

    private static Set<String> asSet(List<String> values) {
        return values == null ? Set.of() : new LinkedHashSet<>(values);
    }
}
