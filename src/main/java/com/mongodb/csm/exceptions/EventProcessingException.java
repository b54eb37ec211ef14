package com.mongodb.csm.exceptions;

public class EventProcessingException extends ChangeStreamException {

    private final String operationType;

    public EventProcessingException(String operationType, Throwable cause) {
        super("Error processing change stream event (" + operationType + "): " + cause.getMessage(), cause);
        this.operationType = operationType;
    }

    public String getOperationType() {
        return operationType;
    }
}
