package com.botops.campaigns.service;

/**
 * Pause taken before each recipient send so provider rate limits are not tripped.
 */
@FunctionalInterface
public interface SendPacer {
    void pause() throws InterruptedException;
}
