package com.qubi.sitepoller;

import com.qubi.sitepoller.config.ConfigLoader;
import com.qubi.sitepoller.config.LoadedConfig;
import com.qubi.sitepoller.core.model.ErrorKind;
import com.qubi.sitepoller.core.model.PollOutcome;
import com.qubi.sitepoller.core.normalize.ReadingNormalizer;
import com.qubi.sitepoller.core.runtime.CollectorRouter;
import com.qubi.sitepoller.core.runtime.PollScheduler;
import com.qubi.sitepoller.core.spi.CollectException;
import com.qubi.sitepoller.core.spi.MetricSink;
import com.qubi.sitepoller.plugins.prometheus.MetricCatalog;
import com.qubi.sitepoller.plugins.prometheus.PrometheusMetricSink;
import com.qubi.sitepoller.plugins.scrape.ScrapeCollector;
import com.qubi.sitepoller.plugins.scrape.ScrapeSettings;
import com.qubi.sitepoller.plugins.snmp.SnmpQueryCollector;
import com.qubi.sitepoller.plugins.snmp.SnmpQuerySettings;
import com.qubi.sitepoller.support.FakeBrowserSession;
import com.qubi.sitepoller.support.SnmpTestAgent;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.snmp4j.smi.Integer32;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pasadas completas con el registry real de Prometheus: browser falso para
 * el scrape y un agente SNMP en loopback para el query.
 */
class SitePollerScenarioTest {

    private SnmpTestAgent agent;
    private CollectorRegistry registry;
    private final Map<String, Double> published = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        agent = new SnmpTestAgent()
                .put("1.3.6.1.2.1.33.1.2.3.0", new Integer32(44))
                .put("1.3.6.1.2.1.33.1.3.3.1.3.1", new Integer32(121));
        // 1.3.6.1.2.1.33.1.2.5.0 no está cargado: el agente devuelve noSuchObject
        registry = new CollectorRegistry();
    }

    @AfterEach
    void tearDown() {
        agent.close();
    }

    private LoadedConfig config(String sites) {
        String yaml = """
                cadenceSeconds: 1
                scrape:
                  waitSeconds: 2
                  schema: [array_current, array_voltage]
                query:
                  timeoutMillis: 1500
                  retries: 1
                  objects:
                    - { name: battery_minutes_remaining, oid: 1.3.6.1.2.1.33.1.2.3.0 }
                    - { name: ups_battery_voltage, oid: 1.3.6.1.2.1.33.1.2.5.0 }
                    - { name: input_voltage, oid: 1.3.6.1.2.1.33.1.3.3.1.3.1 }
                """ + sites;
        return ConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    private PollScheduler scheduler(LoadedConfig cfg, FakeBrowserSession.Factory browsers) {
        MetricCatalog catalog = MetricCatalog.register(registry, cfg.inventory(), cfg.schemas());
        PrometheusMetricSink prometheus = new PrometheusMetricSink(catalog);
        MetricSink recording = (name, value) -> {
            boolean ok = prometheus.publish(name, value);
            if (ok) published.put(name, value);
            return ok;
        };
        return new PollScheduler(
                cfg.inventory(),
                new CollectorRouter(List.of(
                        new ScrapeCollector(ScrapeSettings.from(cfg.raw().scrape), browsers),
                        new SnmpQueryCollector(SnmpQuerySettings.from(cfg.raw().query)))),
                new ReadingNormalizer(),
                cfg.schemas(),
                recording);
    }

    @Test
    void scrapedTilesArePublishedUnderSitePrefix() {
        LoadedConfig cfg = config("""
                sites:
                  Pine:
                    Solar: { kind: scrape, address: 10.0.0.5 }
                """);
        FakeBrowserSession.Factory browsers = new FakeBrowserSession.Factory(
                (cssClass, count, ceiling) -> List.of("array current\n84 V", "array voltage\n12.1 V"));

        List<PollOutcome> outcomes = scheduler(cfg, browsers).runCycle();

        assertTrue(outcomes.get(0).success());
        assertEquals(Map.of("Pine_array_current", 84.0, "Pine_array_voltage", 12.1), published);
        assertEquals(84.0, registry.getSampleValue("Pine_array_current"));
        assertEquals(12.1, registry.getSampleValue("Pine_array_voltage"));
        assertEquals(List.of("http://10.0.0.5/"), browsers.opened.get(0).visited);
        assertEquals(1, browsers.closedCount.get());
    }

    @Test
    void missingRegionPublishesNothingAndNextDeviceStillRuns() {
        LoadedConfig cfg = config("""
                sites:
                  Pine:
                    Solar: { kind: scrape, address: 10.0.0.5 }
                    Ups:   { kind: query,  address: "%s" }
                """.formatted(agent.address()));
        FakeBrowserSession.Factory browsers = new FakeBrowserSession.Factory((cssClass, count, ceiling) -> {
            throw new CollectException(ErrorKind.STRUCTURE_ERROR, "region ." + cssClass + " not found");
        });

        List<PollOutcome> outcomes = scheduler(cfg, browsers).runCycle();

        assertEquals(2, outcomes.size());
        PollOutcome solar = outcomes.get(0);
        assertFalse(solar.success());
        assertEquals(ErrorKind.STRUCTURE_ERROR, solar.error());
        assertEquals(0, solar.published());
        assertTrue(published.keySet().stream().noneMatch(n -> n.startsWith("Pine_array_")));
        assertEquals(1, browsers.closedCount.get());

        PollOutcome ups = outcomes.get(1);
        assertEquals("Ups", ups.device());
        assertTrue(ups.success());
        assertEquals(1, agent.requests());
    }

    @Test
    void queryWithOneMissingObjectPublishesTheOtherTwo() {
        LoadedConfig cfg = config("""
                sites:
                  Ridge:
                    Ups: { kind: query, address: "%s" }
                """.formatted(agent.address()));

        List<PollOutcome> outcomes = scheduler(cfg, new FakeBrowserSession.Factory((c, n, t) -> List.of())).runCycle();

        assertTrue(outcomes.get(0).success());
        assertEquals(2, outcomes.get(0).published());
        assertEquals(Map.of("Ridge_battery_minutes_remaining", 44.0, "Ridge_input_voltage", 121.0), published);
        assertEquals(121.0, registry.getSampleValue("Ridge_input_voltage"));
    }

    @Test
    void laterCycleOverwritesEarlierValue() {
        LoadedConfig cfg = config("""
                sites:
                  Ridge:
                    Ups: { kind: query, address: "%s" }
                """.formatted(agent.address()));
        PollScheduler scheduler = scheduler(cfg, new FakeBrowserSession.Factory((c, n, t) -> List.of()));

        scheduler.runCycle();
        agent.put("1.3.6.1.2.1.33.1.3.3.1.3.1", new Integer32(118));
        scheduler.runCycle();

        assertEquals(118.0, registry.getSampleValue("Ridge_input_voltage"));
        assertEquals(2, scheduler.cyclesCompleted());
    }
}
