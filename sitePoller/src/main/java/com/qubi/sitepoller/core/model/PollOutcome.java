package com.qubi.sitepoller.core.model;

import java.time.Duration;

public record PollOutcome(
        String site,
        String device,
        boolean success,
        ErrorKind error,      // null si success
        String message,
        Duration elapsed,
        int published         // métricas efectivamente publicadas
) {
    public static PollOutcome success(String site, String device, Duration elapsed, int published) {
        return new PollOutcome(site, device, true, null, null, elapsed, published);
    }

    public static PollOutcome failure(String site, String device, ErrorKind error, String message, Duration elapsed) {
        return new PollOutcome(site, device, false, error, message, elapsed, 0);
    }
}
