package com.botops.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Informational only. Whether a job is still live is decided by its presence in the store.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromId(String value) {
        if (value == null) {
            return null;
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
