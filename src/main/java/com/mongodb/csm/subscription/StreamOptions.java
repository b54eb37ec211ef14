package com.mongodb.csm.subscription;

import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.model.changestream.FullDocument;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Options of a change stream. At most one of {@code resumeAfter} and {@code startAtOperationTime} is set.
 */
public record StreamOptions(@Nullable FullDocument fullDocument,
                            int batchSize,
                            Duration maxAwaitTime,
                            @Nullable BsonDocument resumeAfter,
                            @Nullable BsonTimestamp startAtOperationTime) {

    public StreamOptions {
        if (resumeAfter != null && startAtOperationTime != null) {
            throw new IllegalArgumentException("Only one of resumeAfter and startAtOperationTime can be set");
        }
    }

    public StreamOptions withResumeAfter(BsonDocument token) {
        return new StreamOptions(fullDocument, batchSize, maxAwaitTime, token, null);
    }

    public <T> ChangeStreamIterable<T> applyTo(ChangeStreamIterable<T> changeStream) {
        var cs = changeStream
                .batchSize(batchSize)
                .maxAwaitTime(maxAwaitTime.toMillis(), TimeUnit.MILLISECONDS);
        if (fullDocument != null) {
            cs = cs.fullDocument(fullDocument);
        }
        if (resumeAfter != null) {
            cs = cs.resumeAfter(resumeAfter);
        } else if (startAtOperationTime != null) {
            cs = cs.startAtOperationTime(startAtOperationTime);
        }
        return cs;
    }
}
