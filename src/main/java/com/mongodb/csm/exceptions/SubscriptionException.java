package com.mongodb.csm.exceptions;

public class SubscriptionException extends ChangeStreamException {

    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
