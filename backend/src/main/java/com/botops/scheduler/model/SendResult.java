package com.botops.scheduler.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a send that did not throw. A continuation asks the scheduler to run the same
 * job again after the given delay without recording a terminal outcome.
 */
public final class SendResult {

    private static final SendResult COMPLETED = new SendResult(null, null);

    private final Duration continueAfter;
    private final Object response;

    private SendResult(Duration continueAfter, Object response) {
        this.continueAfter = continueAfter;
        this.response = response;
    }

    public static SendResult completed() {
        return COMPLETED;
    }

    public static SendResult completed(Object response) {
        return response == null ? COMPLETED : new SendResult(null, response);
    }

    public static SendResult continueAfter(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("Continuation delay must be zero or positive");
        }
        return new SendResult(delay, null);
    }

    public boolean isContinuation() {
        return continueAfter != null;
    }

    public Optional<Duration> continuationDelay() {
        return Optional.ofNullable(continueAfter);
    }

    /**
     * Provider response kept for the execution log, if the sender returned one.
     */
    public Optional<Object> response() {
        return Optional.ofNullable(response);
    }

    @Override
    public String toString() {
        return continueAfter == null ? "SendResult[completed]" : "SendResult[continueAfter=" + continueAfter + "]";
    }
}
