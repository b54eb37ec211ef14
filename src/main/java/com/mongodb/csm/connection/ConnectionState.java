package com.mongodb.csm.connection;

import java.util.EnumSet;
import java.util.Set;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERRORED,
    CLOSING,
    CLOSED;

    private Set<ConnectionState> next() {
        return switch (this) {
            case DISCONNECTED -> EnumSet.of(CONNECTING, CLOSING);
            case CONNECTING -> EnumSet.of(CONNECTED, ERRORED, CLOSING);
            case CONNECTED -> EnumSet.of(ERRORED, CLOSING);
            case ERRORED -> EnumSet.of(CLOSING);
            case CLOSING -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(ConnectionState.class);
        };
    }

    public boolean canTransitionTo(ConnectionState state) {
        return next().contains(state);
    }
}
