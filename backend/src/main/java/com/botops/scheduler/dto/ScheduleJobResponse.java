package com.botops.scheduler.dto;

public record ScheduleJobResponse(
        boolean scheduled,
        String jobId,
        long scheduledFor
) {
}
