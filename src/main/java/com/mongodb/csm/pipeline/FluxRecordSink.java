package com.mongodb.csm.pipeline;

import com.mongodb.csm.model.EmittedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * A {@link RecordSink} that publishes records as a {@link Flux}. Emission never blocks the change stream:
 * a record that cannot be buffered is dropped and logged.
 */
public class FluxRecordSink implements RecordSink, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FluxRecordSink.class);

    private final Sinks.Many<EmittedRecord> sink;

    public FluxRecordSink() {
        this(Queues.SMALL_BUFFER_SIZE);
    }

    public FluxRecordSink(int bufferSize) {
        this.sink = Sinks.many().multicast().onBackpressureBuffer(bufferSize, false);
    }

    @Override
    public void emit(EmittedRecord record) {
        Sinks.EmitResult result = sink.tryEmitNext(record);
        if (result.isFailure()) {
            logger.warn("Dropped record {} of session {}: {}", record.sequence(), record.sessionId(), result);
        }
    }

    public Flux<EmittedRecord> records() {
        return sink.asFlux();
    }

    @Override
    public void close() {
        sink.tryEmitComplete();
    }
}
