package com.botops.campaigns.model;

public enum RecipientStatus {
    PENDING,
    SENT,
    FAILED,
    BLOCKED,
    INVALID_ID
}
