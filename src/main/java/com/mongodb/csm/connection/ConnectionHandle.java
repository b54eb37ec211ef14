package com.mongodb.csm.connection;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.mongodb.csm.model.ConnectionTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A dedicated connection owned by exactly one session. Handles are never shared, so a failing session
 * cannot starve another one.
 */
public class ConnectionHandle {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandle.class);
    private static final AtomicLong ids = new AtomicLong();

    private final String id;
    private final ConnectionTarget target;
    private final CollectionBindings bindings;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile MongoClient client;

    ConnectionHandle(ConnectionTarget target) {
        this.id = "conn-" + ids.incrementAndGet();
        this.target = target;
        this.bindings = new CollectionBindings(this::client);
    }

    public String getId() {
        return id;
    }

    public ConnectionTarget getTarget() {
        return target;
    }

    public synchronized ConnectionState state() {
        return state;
    }

    public synchronized boolean isClosing() {
        return state == ConnectionState.CLOSING || state == ConnectionState.CLOSED;
    }

    public MongoClient client() {
        var current = state();
        if (current != ConnectionState.CONNECTED) {
            throw new IllegalStateException("Connection " + id + " is " + current);
        }
        return client;
    }

    public MongoDatabase database(String name) {
        return client().getDatabase(name);
    }

    public CollectionBindings bindings() {
        return bindings;
    }

    void attach(MongoClient client) {
        this.client = client;
    }

    synchronized void transition(ConnectionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Cannot move connection " + id + " from " + state + " to " + next);
        }
        logger.trace("Connection {} {} -> {}", id, state, next);
        state = next;
    }

    synchronized void markErrored() {
        if (state.canTransitionTo(ConnectionState.ERRORED)) {
            state = ConnectionState.ERRORED;
        }
    }

    void close() {
        synchronized (this) {
            if (isClosing()) {
                return;
            }
            state = ConnectionState.CLOSING;
        }
        try {
            if (client != null) {
                client.close();
            }
            logger.debug("Closed connection {} to {}", id, target);
        } catch (RuntimeException e) {
            logger.error("Error closing MongoDB connection {}", id, e);
        } finally {
            synchronized (this) {
                state = ConnectionState.CLOSED;
            }
        }
    }

    @Override
    public String toString() {
        return id + "@" + target;
    }
}
