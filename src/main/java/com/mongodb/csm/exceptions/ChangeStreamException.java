package com.mongodb.csm.exceptions;

/**
 * Root of every failure raised by a change stream session.
 */
public class ChangeStreamException extends RuntimeException {

    public ChangeStreamException(String message) {
        super(message);
    }

    public ChangeStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
