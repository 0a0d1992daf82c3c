package com.botops.delivery.error;

import java.time.Duration;

public class RateLimitException extends DeliveryException {

    private final Duration retryAfter;

    /**
     * @param retryAfter provider-supplied wait, or {@code null} when the provider gave none
     */
    public RateLimitException(Duration retryAfter) {
        super(retryAfter == null ? "Rate limited" : "Rate limited. Retry after " + retryAfter.toMillis() + "ms");
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
