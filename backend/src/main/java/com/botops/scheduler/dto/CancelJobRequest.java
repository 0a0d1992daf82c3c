package com.botops.scheduler.dto;

import jakarta.validation.constraints.NotBlank;

public record CancelJobRequest(
        @NotBlank String tenantId,
        @NotBlank String jobId
) {
}
