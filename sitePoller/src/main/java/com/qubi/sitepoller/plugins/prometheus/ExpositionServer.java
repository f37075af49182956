package com.qubi.sitepoller.plugins.prometheus;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

/** Endpoint /metrics para el scrape de Prometheus. */
public class ExpositionServer implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ExpositionServer.class);

    private final int port;
    private final CollectorRegistry registry;
    private HTTPServer server;

    public ExpositionServer(int port, CollectorRegistry registry) {
        this.port = port;
        this.registry = registry;
    }

    public void start() throws IOException {
        server = new HTTPServer.Builder()
                .withPort(port)
                .withRegistry(registry)
                .withDaemonThreads(true)
                .build();
        log.info("[start] exposition endpoint on :{}/metrics", server.getPort());
    }

    @Override
    public void close() {
        if (server != null) {
            server.close();
            log.info("[stop] exposition endpoint closed");
        }
    }
}
