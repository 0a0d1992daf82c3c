package com.botops.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Scheduler scheduler,
        Campaign campaign,
        Telegram telegram,
        Discord discord
) {

    public record Scheduler(
            String keyPrefix,
            String store,
            String zone,
            Dispatcher dispatcher,
            Retry retry,
            Lease lease
    ) {}

    /**
     * Per-tenant run lease shared by all nodes. The TTL bounds how long a crashed node can hold
     * a tenant and must exceed the longest alarm run.
     */
    public record Lease(
            long ttlMs,
            long retryMs
    ) {}

    public record Dispatcher(
            boolean enabled,
            long delayMs,
            int maxTenantsPerPoll,
            int workerThreads
    ) {}

    public record Retry(
            int maxAttempts,
            long baseBackoffMs,
            long maxBackoffMs,
            long defaultRateLimitRetryMs
    ) {}

    public record Campaign(
            int batchSize,
            long batchDelayMs,
            long jitterMinMs,
            long jitterMaxMs,
            int recipientLimit,
            long startDelayMs
    ) {}

    public record Telegram(
            String baseUrl
    ) {}

    public record Discord(
            String baseUrl
    ) {}
}
