package com.qubi.sitepoller.plugins.scrape;

import com.qubi.sitepoller.core.model.ErrorKind;
import com.qubi.sitepoller.core.spi.CollectException;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class SeleniumBrowserSession implements BrowserSession {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSession.class);

    private final WebDriver driver;

    public SeleniumBrowserSession(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void navigate(String url, Duration pageLoadCeiling) throws CollectException {
        try {
            driver.manage().timeouts().pageLoadTimeout(pageLoadCeiling);
            driver.get(url);
        } catch (TimeoutException e) {
            throw new CollectException(ErrorKind.CONNECTIVITY_TIMEOUT,
                    "Page load of " + url + " exceeded " + pageLoadCeiling.toSeconds() + "s", e);
        } catch (WebDriverException e) {
            // net::ERR_CONNECTION_REFUSED, ERR_ADDRESS_UNREACHABLE, ERR_NAME_NOT_RESOLVED...
            String msg = String.valueOf(e.getMessage());
            ErrorKind kind = msg.contains("net::ERR_") ? ErrorKind.CONNECTIVITY_TIMEOUT : ErrorKind.PROTOCOL_ERROR;
            throw new CollectException(kind, "Navigation to " + url + " failed: " + firstLine(msg), e);
        }
    }

    @Override
    public List<String> awaitBlockTexts(String cssClass, int count, Duration ceiling) throws CollectException {
        By locator = By.className(cssClass);
        AtomicInteger lastSeen = new AtomicInteger();
        List<WebElement> blocks;
        try {
            blocks = new WebDriverWait(driver, ceiling).until(d -> {
                List<WebElement> found = d.findElements(locator);
                lastSeen.set(found.size());
                return found.size() >= count ? found : null;
            });
        } catch (TimeoutException e) {
            // la página cargó y algunas regiones están: lo que falta es estructura, no red
            if (lastSeen.get() > 0) {
                throw new CollectException(ErrorKind.STRUCTURE_ERROR, "only " + lastSeen.get() + " of " + count
                        + " '" + cssClass + "' regions present after " + ceiling.toMillis() + "ms", e);
            }
            throw new CollectException(ErrorKind.CONNECTIVITY_TIMEOUT,
                    count + " '" + cssClass + "' regions not rendered within " + ceiling.toMillis() + "ms", e);
        }

        List<String> texts = new ArrayList<>(count);
        try {
            for (int i = 0; i < count; i++) {
                String text = blocks.get(i).getText();
                if (text == null || text.isBlank())
                    throw new CollectException(ErrorKind.STRUCTURE_ERROR, "'" + cssClass + "' region " + i + " is empty");
                texts.add(text);
            }
        } catch (NoSuchElementException | StaleElementReferenceException e) {
            throw new CollectException(ErrorKind.STRUCTURE_ERROR,
                    "'" + cssClass + "' region disappeared while reading: " + firstLine(e.getMessage()), e);
        }
        return texts;
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("[scrape] browser quit failed: {}", firstLine(e.getMessage()));
        }
    }

    private static String firstLine(String s) {
        if (s == null) return "";
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }
}
