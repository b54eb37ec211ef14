package com.mongodb.csm.session;

import com.mongodb.csm.checkpoint.CheckpointState;
import com.mongodb.csm.checkpoint.CheckpointStore;
import com.mongodb.csm.checkpoint.CheckpointTarget;
import com.mongodb.csm.connection.ConnectionHandle;
import com.mongodb.csm.connection.ConnectionManager;
import com.mongodb.csm.exceptions.ChangeStreamException;
import com.mongodb.csm.exceptions.SubscriptionException;
import com.mongodb.csm.model.ConnectionTarget;
import com.mongodb.csm.model.ResumeToken;
import com.mongodb.csm.model.SessionConfiguration;
import com.mongodb.csm.pipeline.EventPipeline;
import com.mongodb.csm.pipeline.RecordSink;
import com.mongodb.csm.subscription.SubscriptionBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One monitored change stream: a dedicated connection, an optional checkpoint and a single subscription.
 * <p>
 * {@link #start()} connects, loads the checkpoint, subscribes and returns once the stream is active. Records
 * are then emitted to the {@link RecordSink} from the session's own worker thread until {@link #close()}.
 * Sessions share nothing, run as many as there are streams to monitor.
 */
public class ChangeStreamSession implements AutoCloseable {
    private static final Duration STOP_GRACE_PERIOD = Duration.ofSeconds(5);
    private static final AtomicLong ids = new AtomicLong();

    private final Logger logger = LoggerFactory.getLogger(ChangeStreamSession.class);
    private final String id;
    private final ConnectionTarget target;
    private final SessionConfiguration config;
    private final RecordSink sink;
    private final ConnectionManager connectionManager;
    private final CheckpointStore checkpointStore;
    private final Clock clock;
    private final @Nullable CheckpointTarget checkpointTarget;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final AtomicBoolean closing = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch closed = new CountDownLatch(1);
    private final ExecutorService executor;

    private volatile ConnectionHandle handle;
    private volatile ChangeStreamWorker worker;
    private volatile Future<Integer> workerFuture;

    public ChangeStreamSession(ConnectionTarget target, SessionConfiguration config, RecordSink sink) {
        this(target, config, sink, new ConnectionManager(), Clock.systemUTC());
    }

    public ChangeStreamSession(ConnectionTarget target,
                               SessionConfiguration config,
                               RecordSink sink,
                               ConnectionManager connectionManager,
                               Clock clock) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.sink = Objects.requireNonNull(sink, "sink cannot be null");
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        config.validate();

        this.id = "session-" + ids.incrementAndGet();
        this.checkpointStore = new CheckpointStore(clock, config.getDebug());
        // derived once, the key must not change while the session lives
        this.checkpointTarget = config.getCheckpoint().isEnabled()
                ? config.getCheckpoint().resolve(config.getDatabase(), config.getCollection())
                : null;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, "csm-" + id);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @throws ChangeStreamException if the session could not be started, everything opened so far is closed again
     */
    public ChangeStreamSession start() {
        if (!state.compareAndSet(SessionState.IDLE, SessionState.CONNECTING)) {
            throw new IllegalStateException("Session " + id + " cannot be started, it is " + state.get());
        }
        logger.info("Starting change stream session {} on {} ({})", id, config.describeTarget(), target);
        if (checkpointTarget != null) {
            logger.info("Resume tokens of session {} are kept in {}.{} under key '{}', save frequency {}", id,
                    checkpointTarget.database(), checkpointTarget.collection(), checkpointTarget.key(), checkpointTarget.saveFrequency());
        }

        try {
            handle = connectionManager.open(target, config.getConnectTimeout());

            ResumeToken loaded = null;
            if (checkpointTarget != null) {
                advance(SessionState.LOADING_CHECKPOINT);
                loaded = checkpointStore.load(handle, checkpointTarget.database(), checkpointTarget.collection(), checkpointTarget.key())
                        .orElse(null);
            }

            advance(SessionState.SUBSCRIBING);
            var subscription = SubscriptionBuilder.build(config, loaded);
            logger.info("Initiating change stream of session {} with pipeline: {}", id, subscription.pipeline());
            if (loaded != null) {
                logger.info("Change stream of session {} resuming from {}", id, loaded);
            }
            var cursor = subscription.open(handle, config);

            var checkpointState = CheckpointState.initial(loaded);
            worker = new ChangeStreamWorker(
                    id,
                    cursor,
                    token -> (token == null ? subscription : subscription.resumeAfter(token)).open(handle, config),
                    new EventPipeline(id, config.getOutputFormat(), sink, clock, config.getDebug()),
                    checkpointer(checkpointState),
                    config.getResubscribeStrategy(),
                    stopSignal,
                    config.isEmitStreamErrors(),
                    config.getDebug(),
                    this::close);

            advance(SessionState.ACTIVE);
            workerFuture = executor.submit(worker);
        } catch (ChangeStreamException e) {
            logger.error("Failed to initialize change stream session {}: {}", id, e.getMessage());
            unwindStartup();
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to initialize change stream session {}", id, e);
            unwindStartup();
            throw new SubscriptionException("Failed to initialize change stream: " + e.getMessage(), e);
        }

        logger.info("Change stream session {} active on {}", id, config.describeTarget());
        return this;
    }

    private ChangeStreamWorker.Checkpointer checkpointer(CheckpointState checkpointState) {
        if (checkpointTarget == null) {
            return token -> {
            };
        }
        return token -> checkpointStore.save(handle,
                checkpointTarget.database(),
                checkpointTarget.collection(),
                checkpointTarget.key(),
                token,
                checkpointTarget.saveFrequency(),
                checkpointState);
    }

    /**
     * A concurrent {@link #close()} may have run before the handle or the cursor existed, so both are released
     * here as well. Closing them twice is harmless.
     */
    private void unwindStartup() {
        close();
        var currentWorker = worker;
        if (currentWorker != null && workerFuture == null) {
            currentWorker.closeCursor();
        }
        try {
            connectionManager.close(handle);
        } catch (RuntimeException e) {
            logger.error("Error closing the connection of session {}", id, e);
        }
    }

    private void advance(SessionState next) {
        SessionState previous = state.getAndUpdate(current -> current.isClosingOrClosed() ? current : next);
        if (previous.isClosingOrClosed()) {
            throw new SubscriptionException("Session " + id + " was closed during startup");
        }
        logger.debug("Session {} {} -> {}", id, previous, next);
    }

    /**
     * Stops the subscription, then closes the connection. Safe to call any number of times and from any thread,
     * failures are logged and never thrown.
     */
    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        stopSignal.countDown();
        SessionState previous = state.getAndSet(SessionState.CLOSING);
        logger.info("Closing change stream session {} (was {})", id, previous);

        try {
            stopSubscription();
        } catch (RuntimeException e) {
            logger.error("Error stopping the change stream of session {}", id, e);
        }
        try {
            connectionManager.close(handle);
        } catch (RuntimeException e) {
            logger.error("Error closing the connection of session {}", id, e);
        }

        executor.shutdown();
        state.set(SessionState.CLOSED);
        closed.countDown();
        logger.info("Change stream session {} closed", id);
    }

    private void stopSubscription() {
        var currentWorker = worker;
        if (currentWorker == null) {
            return;
        }
        var future = workerFuture;
        if (future == null) {
            currentWorker.closeCursor();
            return;
        }
        if (currentWorker.isWorkerThread()) {
            // the worker gave up and closes its own cursor on the way out
            return;
        }
        try {
            future.get(config.getMaxAwaitTime().plus(STOP_GRACE_PERIOD).toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Change stream worker of session {} did not stop in time, closing its cursor", id);
            currentWorker.closeCursor();
            future.cancel(true);
        } catch (ExecutionException e) {
            logger.error("Change stream worker of session {} failed", id, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            currentWorker.closeCursor();
        }
    }

    /**
     * @return {@code true} if the session closed within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String getId() {
        return id;
    }

    public SessionState state() {
        return state.get();
    }

    @Nullable
    public CheckpointTarget getCheckpointTarget() {
        return checkpointTarget;
    }

    @Nullable
    public ResumeToken lastSeenToken() {
        var currentWorker = worker;
        return currentWorker == null ? null : currentWorker.lastSeenToken();
    }
}
