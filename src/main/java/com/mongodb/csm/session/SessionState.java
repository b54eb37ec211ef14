package com.mongodb.csm.session;

public enum SessionState {
    IDLE,
    CONNECTING,
    LOADING_CHECKPOINT,
    SUBSCRIBING,
    ACTIVE,
    CLOSING,
    CLOSED;

    public boolean isClosingOrClosed() {
        return this == CLOSING || this == CLOSED;
    }
}
