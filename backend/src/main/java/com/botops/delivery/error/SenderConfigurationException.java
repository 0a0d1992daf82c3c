package com.botops.delivery.error;

/**
 * Missing sender, campaign, bot or credentials. Never retried.
 */
public class SenderConfigurationException extends DeliveryException {

    public SenderConfigurationException(String message) {
        super(message);
    }
}
