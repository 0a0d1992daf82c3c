package com.botops.campaigns.model;

public enum CampaignStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    COMPLETED
}
