package com.botops.delivery.error;

public class BlockedRecipientException extends DeliveryException {

    public BlockedRecipientException(String message) {
        super(message == null || message.isBlank() ? "User blocked the bot" : message);
    }
}
