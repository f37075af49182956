package com.qubi.sitepoller.plugins.scrape;

import com.qubi.sitepoller.core.model.ErrorKind;
import com.qubi.sitepoller.core.spi.CollectException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeDriverService;
import org.openqa.selenium.chrome.ChromeOptions;

import java.io.File;

/** Un ChromeDriver headless nuevo por intento. */
public class ChromeSessionFactory implements BrowserSessionFactory {

    private final ScrapeSettings settings;

    public ChromeSessionFactory(ScrapeSettings settings) {
        this.settings = settings;
    }

    @Override
    public BrowserSession open() throws CollectException {
        ChromeOptions options = new ChromeOptions();
        options.addArguments(settings.browserArgs());
        if (settings.browserBinary() != null) options.setBinary(settings.browserBinary());

        try {
            ChromeDriver driver;
            if (settings.chromeDriverPath() != null) {
                ChromeDriverService service = new ChromeDriverService.Builder()
                        .usingDriverExecutable(new File(settings.chromeDriverPath()))
                        .usingAnyFreePort()
                        .build();
                driver = new ChromeDriver(service, options);
            } else {
                driver = new ChromeDriver(options);
            }
            return new SeleniumBrowserSession(driver);
        } catch (WebDriverException e) {
            throw new CollectException(ErrorKind.CONFIGURATION_ERROR,
                    "Cannot start headless browser: " + e.getMessage(), e);
        }
    }
}
