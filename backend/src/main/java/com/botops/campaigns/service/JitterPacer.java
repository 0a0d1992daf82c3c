package com.botops.campaigns.service;

import com.botops.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

@Component
public class JitterPacer implements SendPacer {

    private final long minMs;
    private final long maxMs;

    public JitterPacer(AppProperties appProperties) {
        AppProperties.Campaign campaign = appProperties.campaign();
        this.minMs = Math.max(0, campaign.jitterMinMs());
        this.maxMs = Math.max(minMs, campaign.jitterMaxMs());
    }

    @Override
    public void pause() throws InterruptedException {
        long delay = maxMs == minMs ? minMs : ThreadLocalRandom.current().nextLong(minMs, maxMs + 1);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }
}
