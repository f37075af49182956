package com.qubi.sitepoller.core.runtime;

import com.qubi.sitepoller.core.model.ErrorKind;
import com.qubi.sitepoller.core.model.PollOutcome;
import com.qubi.sitepoller.core.spi.PollOutcomeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingOutcomeListener implements PollOutcomeListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingOutcomeListener.class);

    @Override
    public void onOutcome(PollOutcome o) {
        if (o.success()) {
            log.info("[poll] {}/{} ok published={} in {}ms", o.site(), o.device(), o.published(), o.elapsed().toMillis());
        } else if (o.error() == ErrorKind.CONFIGURATION_ERROR) {
            log.error("[poll] {}/{} {}: {}", o.site(), o.device(), o.error(), o.message());
        } else {
            log.warn("[poll] {}/{} failed {} after {}ms: {}", o.site(), o.device(), o.error(), o.elapsed().toMillis(), o.message());
        }
    }
}
