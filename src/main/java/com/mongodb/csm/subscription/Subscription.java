package com.mongodb.csm.subscription;

import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.csm.connection.ConnectionHandle;
import com.mongodb.csm.model.ResumeToken;
import com.mongodb.csm.model.SessionConfiguration;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.List;

/**
 * A change stream ready to be opened: the aggregation pipeline and the stream options.
 */
public record Subscription(List<Bson> pipeline, StreamOptions options) {

    public Subscription {
        pipeline = List.copyOf(pipeline);
    }

    /**
     * @return the same subscription positioned right after {@code token}
     */
    public Subscription resumeAfter(ResumeToken token) {
        return new Subscription(pipeline, options.withResumeAfter(token.asBsonDocument()));
    }

    /**
     * Starts the change stream at the configured scope. The aggregate command runs here, so an invalid
     * pipeline or resume token fails now and not on the first poll.
     */
    public MongoChangeStreamCursor<ChangeStreamDocument<Document>> open(ConnectionHandle handle, SessionConfiguration config) {
        ChangeStreamIterable<Document> changeStream = switch (config.getScope()) {
            case COLLECTION -> handle.bindings().collection(config.getDatabase(), config.getCollection()).watch(pipeline);
            case DATABASE -> handle.database(config.getDatabase()).watch(pipeline);
            case DEPLOYMENT -> handle.client().watch(pipeline);
        };
        return options.applyTo(changeStream).cursor();
    }
}
