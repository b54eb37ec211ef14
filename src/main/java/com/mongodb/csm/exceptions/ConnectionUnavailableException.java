package com.mongodb.csm.exceptions;

/**
 * The connection was established but the administrative ping did not succeed.
 */
public class ConnectionUnavailableException extends ChangeStreamException {

    public ConnectionUnavailableException(String message) {
        super(message);
    }

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
