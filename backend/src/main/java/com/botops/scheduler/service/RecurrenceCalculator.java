package com.botops.scheduler.service;

import com.botops.config.AppProperties;
import com.botops.scheduler.model.Recurrence;
import com.botops.scheduler.model.RecurrenceType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.OptionalLong;

/**
 * Next occurrence of a recurring job, evaluated in the configured scheduler zone.
 * Only daily and weekly rules produce a next run; monthly and once are terminal.
 */
@Component
public class RecurrenceCalculator {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    private final Clock clock;
    private final ZoneId zone;

    public RecurrenceCalculator(Clock clock, AppProperties appProperties) {
        this.clock = clock;
        this.zone = ZoneId.of(appProperties.scheduler().zone());
    }

    public OptionalLong nextRun(Recurrence recurrence, long lastScheduledFor) {
        if (recurrence == null || recurrence.type() == null) {
            return OptionalLong.empty();
        }

        long base = Math.max(clock.millis(), lastScheduledFor);
        ZonedDateTime date = Instant.ofEpochMilli(base).atZone(zone);

        if (recurrence.type() == RecurrenceType.DAILY) {
            date = date.plusDays(1);
        } else if (recurrence.type() == RecurrenceType.WEEKLY) {
            date = date.plusDays(7);
        } else {
            return OptionalLong.empty();
        }

        if (recurrence.time() != null && !recurrence.time().isBlank()) {
            LocalTime time = parseTime(recurrence.time());
            date = date.truncatedTo(ChronoUnit.DAYS)
                    .withHour(time.getHour())
                    .withMinute(time.getMinute());
        }
        return OptionalLong.of(date.toInstant().toEpochMilli());
    }

    /**
     * @throws IllegalArgumentException when the value is not a valid {@code HH:mm} time
     */
    public static LocalTime parseTime(String value) {
        try {
            return LocalTime.parse(value.trim(), TIME_FORMAT);
        } catch (DateTimeException exception) {
            throw new IllegalArgumentException("Invalid recurrence time, expected HH:mm: " + value, exception);
        }
    }
}
