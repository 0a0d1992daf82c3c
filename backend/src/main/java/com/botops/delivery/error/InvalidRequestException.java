package com.botops.delivery.error;

public class InvalidRequestException extends DeliveryException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
