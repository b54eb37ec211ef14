package com.mongodb.csm.connection;

import com.mongodb.connection.ClusterDescription;
import com.mongodb.connection.ServerDescription;
import com.mongodb.csm.exceptions.ChangeStreamException;
import com.mongodb.csm.exceptions.ConnectionException;
import com.mongodb.csm.exceptions.ConnectionException.Reason;
import com.mongodb.csm.exceptions.ConnectionTimeoutException;
import com.mongodb.csm.model.ConnectionTarget;
import com.mongodb.event.ClusterDescriptionChangedEvent;
import com.mongodb.event.ClusterListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Waits until the driver reports a usable server and afterwards logs connection loss and recovery.
 */
class ClusterReadiness implements ClusterListener {
    private static final Logger logger = LoggerFactory.getLogger(ClusterReadiness.class);

    private final ConnectionTarget target;
    private final BooleanSupplier closing;
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private volatile Throwable lastServerException;
    private volatile boolean available;

    ClusterReadiness(ConnectionTarget target, BooleanSupplier closing) {
        this.target = target;
        this.closing = closing;
    }

    @Override
    public void clusterDescriptionChanged(ClusterDescriptionChangedEvent event) {
        ClusterDescription description = event.getNewDescription();
        boolean nowAvailable = description.getServerDescriptions().stream().anyMatch(ServerDescription::isOk);

        description.getServerDescriptions().stream()
                .map(ServerDescription::getException)
                .filter(Objects::nonNull)
                .findFirst()
                .ifPresent(e -> lastServerException = e);

        if (description.getSrvResolutionException() != null) {
            ready.completeExceptionally(new ConnectionException(Reason.HOST_NOT_FOUND, description.getSrvResolutionException()));
        }

        if (ready.isDone() && !closing.getAsBoolean()) {
            if (available && !nowAvailable) {
                logger.warn("MongoDB disconnected from {}", target);
            } else if (!available && nowAvailable) {
                logger.info("MongoDB reconnected to {}", target);
            }
        }
        available = nowAvailable;

        if (nowAvailable) {
            ready.complete(null);
        }
    }

    /**
     * Blocks until a server is usable. Hosts that cannot be resolved or refuse connections are reported as such
     * when the timeout expires, anything else as a timeout.
     */
    void await(Duration timeout) {
        try {
            ready.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            Throwable serverException = lastServerException;
            if (serverException != null) {
                Reason reason = ConnectionFailures.reasonOf(serverException);
                if (reason != Reason.UNKNOWN) {
                    throw new ConnectionException(reason, serverException);
                }
            }
            throw new ConnectionTimeoutException(timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ChangeStreamException changeStreamException) {
                throw changeStreamException;
            }
            throw new ConnectionException(ConnectionFailures.reasonOf(e.getCause()), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException(Reason.UNKNOWN, "Interrupted while connecting to " + target);
        }
    }
}
