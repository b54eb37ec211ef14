package com.mongodb.csm.exceptions;

import java.time.Duration;

public class ConnectionTimeoutException extends ChangeStreamException {

    private final Duration timeout;

    public ConnectionTimeoutException(Duration timeout) {
        super("Change stream connection timeout after " + timeout.toMillis() + " ms. " +
                "Please check network connectivity and firewall settings.");
        this.timeout = timeout;
    }

    public ConnectionTimeoutException(Duration timeout, Throwable cause) {
        super("Change stream connection timeout after " + timeout.toMillis() + " ms. " +
                "Please check network connectivity and firewall settings.", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
