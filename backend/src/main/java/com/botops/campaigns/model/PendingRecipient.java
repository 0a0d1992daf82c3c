package com.botops.campaigns.model;

import java.util.UUID;

/**
 * A pending recipient joined with its customer's delivery address. {@code externalId} is null
 * when the customer row is gone or has no address.
 */
public record PendingRecipient(
        UUID id,
        UUID customerId,
        String externalId,
        String provider
) {
}
