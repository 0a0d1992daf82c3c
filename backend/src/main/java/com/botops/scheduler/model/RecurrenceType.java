package com.botops.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecurrenceType {
    DAILY,
    WEEKLY,
    MONTHLY,
    ONCE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RecurrenceType fromId(String value) {
        if (value == null) {
            return null;
        }
        return RecurrenceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
