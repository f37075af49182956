package com.qubi.sitepoller.plugins.scrape;

import com.qubi.sitepoller.config.AppConfig;
import com.qubi.sitepoller.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ScrapeSettingsTest {

    @Test
    void defaultsMatchTileContract() {
        ScrapeSettings s = ScrapeSettings.from(new AppConfig.ScrapeConfig());

        assertEquals("tile", s.contentClass());
        assertEquals(2, s.blockCount());
        assertEquals(Duration.ofSeconds(45), s.waitCeiling());
        assertTrue(s.browserArgs().contains("--headless=new"));
    }

    @Test
    void rejectsNonPositiveCeiling() {
        AppConfig.ScrapeConfig cfg = new AppConfig.ScrapeConfig();
        cfg.waitSeconds = 0;
        assertThrows(ConfigurationException.class, () -> ScrapeSettings.from(cfg));
    }
}
