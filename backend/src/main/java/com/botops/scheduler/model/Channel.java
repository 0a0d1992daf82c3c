package com.botops.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Channel {
    TELEGRAM,
    DISCORD,
    WHATSAPP,
    CAMPAIGN;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Channel fromId(String value) {
        if (value == null) {
            return null;
        }
        return Channel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
