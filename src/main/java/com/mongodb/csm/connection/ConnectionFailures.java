package com.mongodb.csm.connection;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoSecurityException;
import com.mongodb.csm.exceptions.ConnectionException.Reason;

import java.net.ConnectException;
import java.net.UnknownHostException;

/**
 * Maps driver failures onto a {@link Reason} the user can act upon.
 */
final class ConnectionFailures {
    private static final int UNAUTHORIZED = 13;

    private ConnectionFailures() {
    }

    static Reason reasonOf(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof MongoSecurityException) {
                return Reason.AUTHENTICATION_FAILED;
            } else if (t instanceof MongoCommandException commandException && commandException.getErrorCode() == UNAUTHORIZED) {
                return Reason.NOT_AUTHORIZED;
            } else if (t instanceof UnknownHostException) {
                return Reason.HOST_NOT_FOUND;
            } else if (t instanceof ConnectException) {
                return Reason.CONNECTION_REFUSED;
            }
            String message = t.getMessage();
            if (message != null) {
                if (message.contains("Authentication failed")) {
                    return Reason.AUTHENTICATION_FAILED;
                } else if (message.contains("not authorized")) {
                    return Reason.NOT_AUTHORIZED;
                } else if (message.contains("ENOTFOUND")) {
                    return Reason.HOST_NOT_FOUND;
                } else if (message.contains("ECONNREFUSED")) {
                    return Reason.CONNECTION_REFUSED;
                }
            }
        }
        return Reason.UNKNOWN;
    }
}
