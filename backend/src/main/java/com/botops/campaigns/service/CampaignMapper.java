package com.botops.campaigns.service;

import com.botops.campaigns.dto.CampaignResponse;
import com.botops.campaigns.dto.RecipientResponse;
import com.botops.campaigns.model.CampaignEntity;
import com.botops.campaigns.model.RecipientEntity;

import java.util.Locale;

public final class CampaignMapper {

    private CampaignMapper() {
    }

    public static CampaignResponse toResponse(CampaignEntity campaign) {
        return new CampaignResponse(
                campaign.getId(),
                campaign.getTenantId(),
                campaign.getName(),
                campaign.getSegment(),
                campaign.getBotId(),
                campaign.getStatus().name().toLowerCase(Locale.ROOT),
                campaign.getFrequency() == null ? null : campaign.getFrequency().id(),
                campaign.getStartTime(),
                campaign.getTotalTargeted(),
                campaign.getTotalSent(),
                campaign.getTotalFailed(),
                campaign.getSchedulerJobId(),
                campaign.getCreatedAt(),
                campaign.getUpdatedAt()
        );
    }

    public static RecipientResponse toResponse(RecipientEntity recipient) {
        return new RecipientResponse(
                recipient.getId(),
                recipient.getCustomerId(),
                recipient.getStatus().name().toLowerCase(Locale.ROOT),
                recipient.getErrorCode(),
                recipient.getUpdatedAt() == null ? recipient.getCreatedAt() : recipient.getUpdatedAt()
        );
    }
}
