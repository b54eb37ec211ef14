package com.mongodb.csm.model;

import com.mongodb.ConnectionString;

import java.util.Objects;

/**
 * A resolved connection target. Credentials are part of the connection string and are never logged.
 */
public record ConnectionTarget(ConnectionString connectionString) {

    public ConnectionTarget {
        Objects.requireNonNull(connectionString, "connectionString cannot be null");
    }

    public static ConnectionTarget of(String connectionString) {
        return new ConnectionTarget(new ConnectionString(connectionString));
    }

    @Override
    public String toString() {
        return String.join(",", connectionString.getHosts());
    }
}
