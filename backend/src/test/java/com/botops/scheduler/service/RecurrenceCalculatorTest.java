package com.botops.scheduler.service;

import com.botops.scheduler.model.Recurrence;
import com.botops.scheduler.model.RecurrenceType;
import com.botops.support.MutableClock;
import com.botops.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceCalculatorTest {

    private MutableClock clock;
    private RecurrenceCalculator calculator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-10T08:30:00Z"));
        calculator = new RecurrenceCalculator(clock, TestProperties.defaults());
    }

    @Test
    void dailyMovesToNextDayAtGivenTime() {
        long last = Instant.parse("2024-03-10T08:30:00Z").toEpochMilli();

        assertThat(calculator.nextRun(new Recurrence(RecurrenceType.DAILY, "09:00", null), last))
                .hasValue(Instant.parse("2024-03-11T09:00:00Z").toEpochMilli());
    }

    @Test
    void weeklyWithoutTimeKeepsTimeOfDay() {
        long last = Instant.parse("2024-03-10T08:30:00Z").toEpochMilli();

        assertThat(calculator.nextRun(new Recurrence(RecurrenceType.WEEKLY, null, null), last))
                .hasValue(Instant.parse("2024-03-17T08:30:00Z").toEpochMilli());
    }

    @Test
    void usesCurrentTimeWhenLastRunIsStale() {
        long stale = Instant.parse("2024-03-01T09:00:00Z").toEpochMilli();

        assertThat(calculator.nextRun(new Recurrence(RecurrenceType.DAILY, "07:15", null), stale))
                .hasValue(Instant.parse("2024-03-11T07:15:00Z").toEpochMilli());
    }

    @Test
    void monthlyAndOnceAreTerminal() {
        long last = clock.millis();

        assertThat(calculator.nextRun(new Recurrence(RecurrenceType.MONTHLY, "09:00", null), last)).isEmpty();
        assertThat(calculator.nextRun(new Recurrence(RecurrenceType.ONCE, null, null), last)).isEmpty();
        assertThat(calculator.nextRun(null, last)).isEmpty();
    }

    @Test
    void nextRunIsAlwaysAfterLastRun() {
        long last = Instant.parse("2024-03-10T23:59:00Z").toEpochMilli();

        assertThat(calculator.nextRun(new Recurrence(RecurrenceType.DAILY, "00:00", null), last).getAsLong())
                .isGreaterThan(last);
    }

    @Test
    void parseTimeRejectsGarbage() {
        assertThat(RecurrenceCalculator.parseTime("7:05").getMinute()).isEqualTo(5);
        assertThatThrownBy(() -> RecurrenceCalculator.parseTime("25:00"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecurrenceCalculator.parseTime("noon"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
