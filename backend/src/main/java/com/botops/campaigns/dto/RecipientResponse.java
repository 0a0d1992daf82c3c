package com.botops.campaigns.dto;

import java.time.Instant;
import java.util.UUID;

public record RecipientResponse(
        UUID id,
        UUID customerId,
        String status,
        Integer errorCode,
        Instant updatedAt
) {
}
