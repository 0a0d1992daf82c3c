package com.botops.progress;

public interface ProgressPublisher {
    void publish(CampaignProgressEvent event);
}
