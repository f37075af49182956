package com.qubi.sitepoller.plugins.scrape;

import com.qubi.sitepoller.core.spi.CollectException;

@FunctionalInterface
public interface BrowserSessionFactory {
    BrowserSession open() throws CollectException;
}
