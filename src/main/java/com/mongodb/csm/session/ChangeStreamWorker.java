package com.mongodb.csm.session;

import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.csm.logging.DebugSettings;
import com.mongodb.csm.model.ResumeToken;
import com.mongodb.csm.pipeline.EventPipeline;
import com.mongodb.csm.retry.RetryStrategy;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonSerializationException;
import org.bson.Document;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the change stream cursor of one session. Events are processed in the order the server reports them
 * and every resume token change is offered to the checkpointer after the event it belongs to.
 * <p>
 * Stopping is cooperative: the stop signal is checked between polls, each poll is bounded by the stream's
 * max await time.
 */
public class ChangeStreamWorker implements Callable<Integer> {

    @FunctionalInterface
    public interface CursorOpener {
        /**
         * @param resumeAfter the last token seen, {@code null} to reopen at the session's original position
         */
        MongoChangeStreamCursor<ChangeStreamDocument<Document>> open(@Nullable ResumeToken resumeAfter);
    }

    @FunctionalInterface
    public interface Checkpointer {
        void offer(ResumeToken token);
    }

    private final Logger logger = LoggerFactory.getLogger(ChangeStreamWorker.class);
    private final String sessionId;
    private final CursorOpener opener;
    private final EventPipeline pipeline;
    private final Checkpointer checkpointer;
    private final RetryStrategy retryStrategy;
    private final CountDownLatch stopSignal;
    private final boolean emitStreamErrors;
    private final DebugSettings debug;
    private final Runnable onGiveUp;
    private final AtomicReference<MongoChangeStreamCursor<ChangeStreamDocument<Document>>> cursor;
    private volatile @Nullable ResumeToken lastSeen;
    private volatile Thread thread;

    public ChangeStreamWorker(String sessionId,
                              MongoChangeStreamCursor<ChangeStreamDocument<Document>> initialCursor,
                              CursorOpener opener,
                              EventPipeline pipeline,
                              Checkpointer checkpointer,
                              RetryStrategy retryStrategy,
                              CountDownLatch stopSignal,
                              boolean emitStreamErrors,
                              DebugSettings debug,
                              Runnable onGiveUp) {
        this.sessionId = sessionId;
        this.cursor = new AtomicReference<>(initialCursor);
        this.opener = opener;
        this.pipeline = pipeline;
        this.checkpointer = checkpointer;
        this.retryStrategy = retryStrategy;
        this.stopSignal = stopSignal;
        this.emitStreamErrors = emitStreamErrors;
        this.debug = debug;
        this.onGiveUp = onGiveUp;
    }

    @Override
    public Integer call() {
        thread = Thread.currentThread();
        logger.info("Change stream worker of session {} started", sessionId);
        int failures = 0;
        try {
            while (!isStopping()) {
                try {
                    poll(currentCursor());
                    failures = 0;
                } catch (RuntimeException e) {
                    if (isStopping()) {
                        break;
                    }
                    logger.error("Change stream error in session {}", sessionId, e);
                    if (emitStreamErrors) {
                        pipeline.reportStreamError(e);
                    }
                    closeCursor();

                    Optional<Duration> delay = retryStrategy.delayBeforeAttempt(++failures);
                    if (delay.isEmpty()) {
                        logger.error("Giving up on the change stream of session {} after {} consecutive failures ({})",
                                sessionId, failures, retryStrategy);
                        onGiveUp.run();
                        return 1;
                    }
                    logger.info("Resubscribing change stream of session {} in {} ms (attempt {}/{})",
                            sessionId, delay.get().toMillis(), failures, retryStrategy.maxAttempts());
                    if (stopSignal.await(delay.get().toMillis(), TimeUnit.MILLISECONDS)) {
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Change stream worker of session {} interrupted", sessionId);
        } finally {
            closeCursor();
            logger.info("Change stream worker of session {} finished", sessionId);
        }
        return 0;
    }

    static boolean isDecodingFailure(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof CodecConfigurationException
                    || cause instanceof BsonInvalidOperationException
                    || cause instanceof BsonSerializationException) {
                return true;
            }
        }
        return false;
    }

    private void poll(MongoChangeStreamCursor<ChangeStreamDocument<Document>> changeStream) {
        ChangeStreamDocument<Document> event;
        try {
            event = changeStream.tryNext();
        } catch (RuntimeException e) {
            if (!isDecodingFailure(e)) {
                throw e;
            }
            // the raw event is already consumed, the cursor carries on with the next one
            pipeline.reportUndecodableEvent(e);
            event = null;
        }
        if (event != null) {
            logger.trace("Handling change stream event {}", event);
            pipeline.process(event);
        }

        BsonDocument token = changeStream.getResumeToken();
        if (token != null) {
            var resumeToken = ResumeToken.of(token);
            if (!resumeToken.equals(lastSeen)) {
                lastSeen = resumeToken;
                if (debug.logTokenChange()) {
                    logger.debug("Resume token changed");
                }
                checkpointer.offer(resumeToken);
            }
        }
    }

    private MongoChangeStreamCursor<ChangeStreamDocument<Document>> currentCursor() {
        var current = cursor.get();
        if (current == null) {
            if (isStopping()) {
                throw new IllegalStateException("Session " + sessionId + " is stopping");
            }
            current = opener.open(lastSeen);
            cursor.set(current);
            logger.info("Change stream of session {} resubscribed {}", sessionId,
                    lastSeen == null ? "at its original position" : "after " + lastSeen);
        }
        return current;
    }

    boolean isStopping() {
        return stopSignal.getCount() == 0;
    }

    /**
     * @return whether the caller is this worker's own thread
     */
    boolean isWorkerThread() {
        return Thread.currentThread() == thread;
    }

    @Nullable
    ResumeToken lastSeenToken() {
        return lastSeen;
    }

    void closeCursor() {
        var current = cursor.getAndSet(null);
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing change stream cursor of session {}: {}", sessionId, e.getMessage());
            }
        }
    }
}
