package com.mongodb.csm.model;

import org.bson.Document;

import javax.annotation.Nullable;

/**
 * A record handed to the consumer of a session.
 *
 * @param sessionId the emitting session
 * @param sequence  1-based position of the record within the session
 * @param eventId   resume token of the originating change event, {@code null} for stream errors
 * @param payload   the projected event or error record
 */
public record EmittedRecord(String sessionId, long sequence, @Nullable String eventId, Document payload) {
}
