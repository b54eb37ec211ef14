package com.mongodb.csm.pipeline;

import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.csm.exceptions.EventProcessingException;
import com.mongodb.csm.logging.DebugSettings;
import com.mongodb.csm.model.EmittedRecord;
import com.mongodb.csm.model.OutputFormat;
import org.bson.BsonDocument;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.Date;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Projects change events into records and hands them to a {@link RecordSink}.
 * <p>
 * Exactly one record is emitted per event. An event that cannot be projected produces a
 * {@code processing_error} record instead and the next event is processed as usual.
 */
public class EventPipeline {
    static final String UNKNOWN_OPERATION = "unknown";

    private final Logger logger = LoggerFactory.getLogger(EventPipeline.class);
    private final String sessionId;
    private final OutputFormat outputFormat;
    private final RecordSink sink;
    private final Clock clock;
    private final DebugSettings debug;
    private final AtomicLong sequence = new AtomicLong();

    public EventPipeline(String sessionId, OutputFormat outputFormat, RecordSink sink, Clock clock, DebugSettings debug) {
        this.sessionId = sessionId;
        this.outputFormat = outputFormat;
        this.sink = sink;
        this.clock = clock;
        this.debug = debug;
    }

    public EmittedRecord process(ChangeStreamDocument<Document> event) {
        Document payload;
        try {
            payload = project(event);
            if (payload == null) {
                payload = noData(event);
            }
        } catch (RuntimeException e) {
            var failure = new EventProcessingException(operationTypeOf(event), e);
            logger.error(failure.getMessage(), failure);
            payload = processingError(e);
        }

        var record = emit(eventIdOf(event), payload);
        if (debug.logEvent()) {
            logger.debug("Change stream event: {}", operationTypeOf(event));
        }
        return record;
    }

    /**
     * Emits the {@code processing_error} record of an event the driver could not decode.
     */
    public EmittedRecord reportUndecodableEvent(RuntimeException error) {
        var failure = new EventProcessingException(UNKNOWN_OPERATION, error);
        logger.error(failure.getMessage(), failure);
        return emit(null, processingError(error));
    }

    /**
     * Emits a {@code change_stream_error} record for a stream-level failure.
     */
    public EmittedRecord reportStreamError(Throwable error) {
        var payload = new Document();
        payload.put("error", error.getMessage());
        payload.put("type", "change_stream_error");
        payload.put("timestamp", now());
        return emit(null, payload);
    }

    @Nullable
    Document project(ChangeStreamDocument<Document> event) {
        return switch (outputFormat) {
            case DOCUMENT -> documentOnly(event);
            case SIMPLIFIED -> simplified(event);
            case FULL -> ChangeEvents.toDocument(event);
        };
    }

    private Document documentOnly(ChangeStreamDocument<Document> event) {
        if (event.getFullDocument() != null) {
            return event.getFullDocument();
        } else if (event.getDocumentKey() != null) {
            return new Document(event.getDocumentKey());
        }
        return new Document();
    }

    private Document simplified(ChangeStreamDocument<Document> event) {
        var doc = new Document();
        doc.put("operationType", operationTypeOf(event));
        doc.put("documentKey", event.getDocumentKey() != null ? event.getDocumentKey() : new BsonDocument());
        doc.put("document", event.getFullDocument());
        doc.put("updateDescription", ChangeEvents.toDocument(event.getUpdateDescription()));
        doc.put("timestamp", event.getClusterTime() != null ? event.getClusterTime() : now());
        return doc;
    }

    private Document noData(ChangeStreamDocument<Document> event) {
        var doc = new Document();
        doc.put("operationType", operationTypeOf(event));
        doc.put("timestamp", now());
        doc.put("error", "No data available");
        return doc;
    }

    private Document processingError(RuntimeException e) {
        var doc = new Document();
        doc.put("operationType", "error");
        doc.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        doc.put("timestamp", now());
        doc.put("type", "processing_error");
        return doc;
    }

    private EmittedRecord emit(@Nullable String eventId, Document payload) {
        var record = new EmittedRecord(sessionId, sequence.incrementAndGet(), eventId, payload);
        try {
            sink.emit(record);
        } catch (RuntimeException e) {
            logger.error("Record sink of session {} failed on record {}", sessionId, record.sequence(), e);
        }
        return record;
    }

    private Date now() {
        return Date.from(clock.instant());
    }

    private static String operationTypeOf(ChangeStreamDocument<Document> event) {
        return event.getOperationTypeString() != null ? event.getOperationTypeString() : UNKNOWN_OPERATION;
    }

    @Nullable
    private static String eventIdOf(ChangeStreamDocument<Document> event) {
        return event.getResumeToken() != null ? event.getResumeToken().toJson() : null;
    }
}
