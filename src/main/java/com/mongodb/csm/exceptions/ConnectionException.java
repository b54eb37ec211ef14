package com.mongodb.csm.exceptions;

/**
 * A driver-reported connection failure. The {@link Reason} tells a host that cannot be resolved
 * apart from a refused connection or rejected credentials.
 */
public class ConnectionException extends ChangeStreamException {

    public enum Reason {
        HOST_NOT_FOUND("Host not found. Please check the hostname/IP address."),
        CONNECTION_REFUSED("Connection refused. Please check if MongoDB is running and the port is correct."),
        AUTHENTICATION_FAILED("Authentication failed. Please check username and password."),
        NOT_AUTHORIZED("Not authorized. Please check user permissions for the database."),
        UNKNOWN("Connection failed.");

        private final String hint;

        Reason(String hint) {
            this.hint = hint;
        }

        public String hint() {
            return hint;
        }
    }

    private final Reason reason;

    public ConnectionException(Reason reason, Throwable cause) {
        super(reason.hint() + " " + cause.getMessage(), cause);
        this.reason = reason;
    }

    public ConnectionException(Reason reason, String message) {
        super(reason.hint() + " " + message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
