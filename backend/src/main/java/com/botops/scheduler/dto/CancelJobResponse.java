package com.botops.scheduler.dto;

public record CancelJobResponse(
        boolean cancelled,
        boolean removed
) {
}
