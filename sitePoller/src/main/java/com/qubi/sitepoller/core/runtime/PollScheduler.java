package com.qubi.sitepoller.core.runtime;

import com.qubi.sitepoller.core.model.Device;
import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.model.ErrorKind;
import com.qubi.sitepoller.core.model.Inventory;
import com.qubi.sitepoller.core.model.MetricSchema;
import com.qubi.sitepoller.core.model.PollOutcome;
import com.qubi.sitepoller.core.model.RawFields;
import com.qubi.sitepoller.core.model.Site;
import com.qubi.sitepoller.core.normalize.ReadingNormalizer;
import com.qubi.sitepoller.core.spi.CollectException;
import com.qubi.sitepoller.core.spi.MetricSink;
import com.qubi.sitepoller.core.spi.PollOutcomeListener;
import com.qubi.sitepoller.core.spi.ProtocolCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Recorre el inventario una vez por ciclo, en orden de sitio y de device, y
 * espera cada poll antes de despachar el siguiente.
 *
 * <p>La pausa se mide desde el fin del ciclo: un ciclo lento corre el período
 * efectivo. Tampoco hay señal de "device caído": un device que falla siempre
 * simplemente no publica.
 */
public class PollScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private final Inventory inventory;
    private final CollectorRouter router;
    private final ReadingNormalizer normalizer;
    private final Map<DeviceKind, MetricSchema> schemas;
    private final MetricSink sink;
    private final Clock clock;
    private volatile PollOutcomeListener listener = new LoggingOutcomeListener();

    private long cycles;

    public PollScheduler(Inventory inventory, CollectorRouter router, ReadingNormalizer normalizer,
                         Map<DeviceKind, MetricSchema> schemas, MetricSink sink) {
        this(inventory, router, normalizer, schemas, sink, Clock.systemUTC());
    }

    public PollScheduler(Inventory inventory, CollectorRouter router, ReadingNormalizer normalizer,
                         Map<DeviceKind, MetricSchema> schemas, MetricSink sink, Clock clock) {
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        this.router = Objects.requireNonNull(router, "router");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.schemas = schemas.isEmpty() ? Map.of() : new EnumMap<>(schemas);
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PollScheduler setListener(PollOutcomeListener l) { this.listener = (l != null) ? l : (o -> {}); return this; }

    /** No vuelve salvo que se interrumpa el hilo. */
    public void runForever(Duration cadence) {
        log.info("[start] polling {} sites / {} devices, pause between cycles {}s",
                inventory.sites().size(), inventory.deviceCount(), cadence.toSeconds());
        while (!Thread.currentThread().isInterrupted()) {
            runCycle();
            try {
                Thread.sleep(cadence.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("[stop] interrupted after {} cycles", cycles);
    }

    public List<PollOutcome> runCycle() {
        long cycle = ++cycles;
        Instant started = clock.instant();
        List<PollOutcome> outcomes = new ArrayList<>(inventory.deviceCount());

        for (Site site : inventory.sites()) {
            for (Device device : site.devices()) {
                PollOutcome o = pollDevice(site, device);
                outcomes.add(o);
                notifyListener(o);
            }
        }

        long ok = outcomes.stream().filter(PollOutcome::success).count();
        int published = outcomes.stream().mapToInt(PollOutcome::published).sum();
        log.info("[cycle] #{} devices={} ok={} failed={} published={} took {}ms",
                cycle, outcomes.size(), ok, outcomes.size() - ok, published,
                Duration.between(started, clock.instant()).toMillis());
        return outcomes;
    }

    PollOutcome pollDevice(Site site, Device device) {
        Instant started = clock.instant();

        Optional<ProtocolCollector> collector = router.resolve(device);
        if (collector.isEmpty()) {
            return PollOutcome.failure(site.id(), device.id(), ErrorKind.CONFIGURATION_ERROR,
                    "no collector for device kind '" + device.kind() + "'", elapsedSince(started));
        }
        MetricSchema schema = schemas.get(collector.get().kind());
        if (schema == null) {
            return PollOutcome.failure(site.id(), device.id(), ErrorKind.CONFIGURATION_ERROR,
                    "no metric schema for " + collector.get().kind(), elapsedSince(started));
        }

        RawFields raw;
        try {
            raw = collector.get().collect(device.address(), site.id());
        } catch (CollectException e) {
            return PollOutcome.failure(site.id(), device.id(), e.kind(), e.getMessage(), elapsedSince(started));
        } catch (RuntimeException e) {
            // un collector roto no corta el ciclo
            log.error("[poll] {}/{} collector threw unexpectedly", site.id(), device.id(), e);
            return PollOutcome.failure(site.id(), device.id(), ErrorKind.PROTOCOL_ERROR,
                    String.valueOf(e), elapsedSince(started));
        }

        Map<String, Double> values = normalizer.normalize(site.id(), raw, schema, schema.exclusionsFor(site.id()));
        int published = 0;
        for (var e : values.entrySet()) {
            if (sink.publish(e.getKey(), e.getValue())) published++;
        }
        return PollOutcome.success(site.id(), device.id(), elapsedSince(started), published);
    }

    private void notifyListener(PollOutcome o) {
        try {
            listener.onOutcome(o);
        } catch (RuntimeException e) {
            log.warn("[poll] outcome listener failed for {}/{}", o.site(), o.device(), e);
        }
    }

    private Duration elapsedSince(Instant started) {
        return Duration.between(started, clock.instant());
    }

    public long cyclesCompleted() {
        return cycles;
    }
}
