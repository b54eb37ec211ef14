package com.mongodb.csm.connection;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.csm.exceptions.ChangeStreamException;
import com.mongodb.csm.exceptions.ConnectionException;
import com.mongodb.csm.exceptions.ConnectionException.Reason;
import com.mongodb.csm.exceptions.ConnectionTimeoutException;
import com.mongodb.csm.exceptions.ConnectionUnavailableException;
import com.mongodb.csm.model.ConnectionTarget;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Opens and closes the dedicated connection of a session. There is no retry in here, a failed open leaves a
 * closed handle behind and reports why.
 */
public class ConnectionManager {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);
    private final MongoClientFactory clientFactory;

    public ConnectionManager() {
        this(MongoClientFactory.standard());
    }

    public ConnectionManager(MongoClientFactory clientFactory) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory cannot be null");
    }

    public ConnectionHandle open(ConnectionTarget target, Duration timeout) {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");

        var handle = new ConnectionHandle(target);
        var readiness = new ClusterReadiness(target, handle::isClosing);
        handle.transition(ConnectionState.CONNECTING);
        logger.debug("Creating dedicated MongoDB connection {}", handle);

        try {
            handle.attach(clientFactory.create(settings(target, timeout, readiness)));
            readiness.await(timeout);
            handle.transition(ConnectionState.CONNECTED);
            ping(handle, timeout);
        } catch (ChangeStreamException e) {
            handle.markErrored();
            close(handle);
            throw e;
        } catch (RuntimeException e) {
            handle.markErrored();
            close(handle);
            throw new ConnectionException(ConnectionFailures.reasonOf(e), e);
        }

        logger.info("Dedicated MongoDB connection {} established and verified", handle);
        return handle;
    }

    /**
     * Idempotent, never throws.
     */
    public void close(ConnectionHandle handle) {
        if (handle != null) {
            handle.close();
        }
    }

    MongoClientSettings settings(ConnectionTarget target, Duration timeout, ClusterReadiness readiness) {
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        return MongoClientSettings.builder()
                .applyConnectionString(target.connectionString())
                .applyToClusterSettings(builder -> builder
                        .serverSelectionTimeout(timeoutMillis, MILLISECONDS)
                        .addClusterListener(readiness))
                .applyToSocketSettings(builder -> builder
                        .connectTimeout(timeoutMillis, MILLISECONDS)
                        // change streams keep a cursor open for as long as the session lives
                        .readTimeout(0, MILLISECONDS))
                .applyToConnectionPoolSettings(builder -> builder
                        .maxSize(10)
                        .minSize(1)
                        .maxConnectionIdleTime(30, SECONDS))
                .applyToServerSettings(builder -> builder.heartbeatFrequency(10, SECONDS))
                .retryWrites(true)
                .retryReads(true)
                .build();
    }

    private void ping(ConnectionHandle handle, Duration timeout) {
        Document result;
        try {
            result = handle.client().getDatabase("admin").runCommand(new Document("ping", 1));
        } catch (MongoTimeoutException e) {
            throw new ConnectionTimeoutException(timeout, e);
        } catch (MongoException e) {
            Reason reason = ConnectionFailures.reasonOf(e);
            if (reason != Reason.UNKNOWN) {
                throw new ConnectionException(reason, e);
            }
            throw new ConnectionUnavailableException("Database connection not available: " + e.getMessage(), e);
        }
        if (!isOk(result)) {
            throw new ConnectionUnavailableException("Database connection not available, ping returned " + (result == null ? "nothing" : result.toJson()));
        }
    }

    private static boolean isOk(Document result) {
        return result != null && result.get("ok") instanceof Number ok && ok.doubleValue() == 1.0;
    }
}
