package com.mongodb.csm.exceptions;

public class CheckpointWriteException extends ChangeStreamException {

    private final String key;

    public CheckpointWriteException(String key, Throwable cause) {
        super("Error saving resume token '" + key + "' to database: " + cause.getMessage(), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
