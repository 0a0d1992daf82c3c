package com.botops.delivery.error;

/**
 * Unclassified delivery failure. Subclasses carry the categories the scheduler and the
 * campaign executor treat differently.
 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
