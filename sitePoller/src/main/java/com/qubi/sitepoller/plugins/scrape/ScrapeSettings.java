package com.qubi.sitepoller.plugins.scrape;

import com.qubi.sitepoller.config.AppConfig;
import com.qubi.sitepoller.config.ConfigurationException;

import java.time.Duration;
import java.util.List;

public record ScrapeSettings(
        String contentClass,      // clase de las regiones label/valor
        int blockCount,           // regiones esperadas (2)
        Duration waitCeiling,     // techo total del intento
        String chromeDriverPath,  // opcional
        String browserBinary,     // opcional
        List<String> browserArgs
) {
    public ScrapeSettings {
        if (contentClass == null || contentClass.isBlank())
            throw new ConfigurationException("scrape.contentClass is required");
        if (blockCount < 1) throw new ConfigurationException("scrape.blockCount must be >= 1");
        if (waitCeiling == null || waitCeiling.isNegative() || waitCeiling.isZero())
            throw new ConfigurationException("scrape.waitSeconds must be > 0");
        browserArgs = browserArgs == null ? List.of() : List.copyOf(browserArgs);
    }

    public static ScrapeSettings from(AppConfig.ScrapeConfig s) {
        return new ScrapeSettings(s.contentClass, s.blockCount, Duration.ofSeconds(s.waitSeconds),
                s.chromeDriverPath, s.browserBinary, s.browserArgs);
    }
}
