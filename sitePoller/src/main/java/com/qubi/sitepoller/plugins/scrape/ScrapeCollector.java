package com.qubi.sitepoller.plugins.scrape;

import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.model.ErrorKind;
import com.qubi.sitepoller.core.model.RawFields;
import com.qubi.sitepoller.core.spi.CollectException;
import com.qubi.sitepoller.core.spi.ProtocolCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Renderiza la página raíz del device y lee las regiones de "tiles". Cada
 * región trae líneas alternadas label/valor; sólo quedan los valores.
 */
public class ScrapeCollector implements ProtocolCollector {

    private static final Logger log = LoggerFactory.getLogger(ScrapeCollector.class);

    private final ScrapeSettings settings;
    private final BrowserSessionFactory sessions;

    public ScrapeCollector(ScrapeSettings settings, BrowserSessionFactory sessions) {
        this.settings = settings;
        this.sessions = sessions;
    }

    @Override
    public DeviceKind kind() {
        return DeviceKind.SCRAPE;
    }

    @Override
    public RawFields collect(String address, String site) throws CollectException {
        String url = "http://" + address + "/";
        long started = System.nanoTime();

        List<String> blocks;
        try (BrowserSession session = sessions.open()) {
            session.navigate(url, settings.waitCeiling());
            Duration remaining = settings.waitCeiling().minusNanos(System.nanoTime() - started);
            if (remaining.isNegative()) remaining = Duration.ZERO;
            blocks = session.awaitBlockTexts(settings.contentClass(), settings.blockCount(), remaining);
        } catch (RuntimeException e) {
            throw new CollectException(ErrorKind.PROTOCOL_ERROR, "Unexpected browser failure on " + url + ": " + e, e);
        }

        List<String> values = valueLines(blocks);
        log.debug("[scrape] {} ({}) -> {} values in {}ms", url, site, values.size(),
                Duration.ofNanos(System.nanoTime() - started).toMillis());
        return RawFields.positional(site, address, values);
    }

    /**
     * Concatena las líneas de todas las regiones (en orden) y se queda con los
     * elementos de índice impar: [label, valor, label, valor, ...] -> [valor, valor, ...].
     */
    static List<String> valueLines(List<String> blockTexts) {
        List<String> lines = new ArrayList<>();
        for (String block : blockTexts) {
            if (block == null) continue;
            for (String line : block.split("\\R")) lines.add(line.trim());
        }
        List<String> values = new ArrayList<>(lines.size() / 2);
        for (int i = 1; i < lines.size(); i += 2) values.add(lines.get(i));
        return values;
    }
}
