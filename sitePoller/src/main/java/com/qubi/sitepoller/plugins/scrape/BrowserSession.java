package com.qubi.sitepoller.plugins.scrape;

import com.qubi.sitepoller.core.spi.CollectException;

import java.time.Duration;
import java.util.List;

/**
 * Una sesión de render (un proceso de browser). Vive sólo durante un collect;
 * {@link #close()} la libera siempre, incluso a mitad de una espera.
 */
public interface BrowserSession extends AutoCloseable {

    void navigate(String url, Duration pageLoadCeiling) throws CollectException;

    /**
     * Espera hasta {@code ceiling} a que existan {@code count} regiones con la
     * clase CSS dada y devuelve el texto de cada una, en orden de documento.
     */
    List<String> awaitBlockTexts(String cssClass, int count, Duration ceiling) throws CollectException;

    @Override
    void close();
}
