package com.botops.delivery.service;

import com.botops.scheduler.model.Channel;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.SendResult;

public interface MessageSender {

    Channel channel();

    /**
     * Performs the outbound work for one job. Failures are reported by throwing a
     * {@link com.botops.delivery.error.DeliveryException} subtype; retry decisions belong to the caller.
     */
    SendResult send(Job job);
}
