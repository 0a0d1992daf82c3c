package com.botops.scheduler.model;

import java.util.List;

/**
 * @param time wall-clock {@code HH:mm} applied to each next occurrence, optional
 * @param days days of week (0 = Sunday), accepted but not used by the calculator
 */
public record Recurrence(
        RecurrenceType type,
        String time,
        List<Integer> days
) {
}
