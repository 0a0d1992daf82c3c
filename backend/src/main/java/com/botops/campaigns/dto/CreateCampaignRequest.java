package com.botops.campaigns.dto;

import com.botops.scheduler.model.RecurrenceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record CreateCampaignRequest(
        @NotBlank @Size(max = 128) String tenantId,
        @NotBlank @Size(max = 200) String name,
        @NotNull UUID botId,
        @NotBlank @Size(max = 4096) String message,
        @Size(max = 100) String segment,
        RecurrenceType frequency,
        @Pattern(regexp = "^([01]?\\d|2[0-3]):[0-5]\\d$", message = "must be HH:mm") String startTime
) {
}
