package com.qubi.sitepoller;

import com.qubi.sitepoller.config.ConfigLoader;
import com.qubi.sitepoller.config.ConfigurationException;
import com.qubi.sitepoller.config.LoadedConfig;
import com.qubi.sitepoller.core.normalize.ReadingNormalizer;
import com.qubi.sitepoller.core.runtime.CollectorRouter;
import com.qubi.sitepoller.core.runtime.PollScheduler;
import com.qubi.sitepoller.plugins.prometheus.ExpositionServer;
import com.qubi.sitepoller.plugins.prometheus.MetricCatalog;
import com.qubi.sitepoller.plugins.prometheus.PrometheusMetricSink;
import com.qubi.sitepoller.plugins.scrape.ChromeSessionFactory;
import com.qubi.sitepoller.plugins.scrape.ScrapeCollector;
import com.qubi.sitepoller.plugins.scrape.ScrapeSettings;
import com.qubi.sitepoller.plugins.snmp.SnmpQueryCollector;
import com.qubi.sitepoller.plugins.snmp.SnmpQuerySettings;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Uso: {@code java -jar site-poller.jar [config.yaml]}. Sin argumento carga
 * {@code sitepoller.yaml} del classpath.
 */
public final class Main {
    private Main(){}

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    // margen para que el poll en curso cierre su browser/socket antes de que la JVM termine
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(15);

    public static void main(String[] args) {
        LoadedConfig cfg;
        try {
            cfg = ConfigLoader.load(args.length > 0 ? args[0] : null);
        } catch (ConfigurationException e) {
            log.error("[config] {}", e.getMessage());
            System.exit(2);
            return;
        }

        CollectorRegistry registry = new CollectorRegistry();
        MetricCatalog catalog = MetricCatalog.register(registry, cfg.inventory(), cfg.schemas());

        ScrapeSettings scrape = ScrapeSettings.from(cfg.raw().scrape);
        PollScheduler scheduler = new PollScheduler(
                cfg.inventory(),
                new CollectorRouter(List.of(
                        new ScrapeCollector(scrape, new ChromeSessionFactory(scrape)),
                        new SnmpQueryCollector(SnmpQuerySettings.from(cfg.raw().query)))),
                new ReadingNormalizer(),
                cfg.schemas(),
                new PrometheusMetricSink(catalog));

        ExpositionServer exposition = new ExpositionServer(cfg.raw().exposition.port, registry);
        try {
            exposition.start();
        } catch (IOException e) {
            log.error("[start] cannot bind exposition port {}: {}", cfg.raw().exposition.port, e.getMessage());
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(
                shutdownHook(Thread.currentThread(), SHUTDOWN_GRACE, exposition::close), "site-poller-shutdown"));

        scheduler.runForever(cfg.cadence());
    }

    /**
     * Interrumpe el hilo de poll y espera (acotado) a que termine, así el
     * try-with-resources del collector en curso llega a liberar la sesión.
     * Recién después corre {@code afterPoll}.
     */
    static Runnable shutdownHook(Thread pollThread, Duration grace, Runnable afterPoll) {
        return () -> {
            log.info("[stop] shutdown requested");
            pollThread.interrupt();
            try {
                pollThread.join(grace.toMillis());
                if (pollThread.isAlive())
                    log.warn("[stop] poll thread still running after {}s, exiting anyway", grace.toSeconds());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                afterPoll.run();
            }
        };
    }
}
