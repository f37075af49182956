package com.qubi.sitepoller.core.spi;

import com.qubi.sitepoller.core.model.PollOutcome;

@FunctionalInterface
public interface PollOutcomeListener {
    void onOutcome(PollOutcome outcome);
}
