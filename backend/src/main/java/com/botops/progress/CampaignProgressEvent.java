package com.botops.progress;

import java.util.List;

/**
 * Pushed to dashboard listeners after each recipient is processed and once more when a campaign completes.
 */
public record CampaignProgressEvent(
        String type,
        String tenantId,
        String campaignId,
        String status,
        int totalTargeted,
        int totalSent,
        int totalFailed,
        List<RecipientDelta> batch
) {

    public static final String CAMPAIGN_UPDATE = "campaign_update";

    public record RecipientDelta(String id, String status) {
    }
}
