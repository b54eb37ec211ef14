package com.mongodb.csm.pipeline;

import com.mongodb.csm.model.EmittedRecord;

/**
 * Receives the records of a session. Implementations must not block, emission is fire-and-forget.
 */
@FunctionalInterface
public interface RecordSink {

    void emit(EmittedRecord record);
}
