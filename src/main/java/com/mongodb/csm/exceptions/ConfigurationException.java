package com.mongodb.csm.exceptions;

/**
 * Invalid session configuration, raised before any connection is attempted.
 */
public class ConfigurationException extends ChangeStreamException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
