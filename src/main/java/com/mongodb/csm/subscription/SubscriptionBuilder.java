package com.mongodb.csm.subscription;

import com.mongodb.csm.model.OperationKind;
import com.mongodb.csm.model.ResumeToken;
import com.mongodb.csm.model.SessionConfiguration;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;
import org.bson.conversions.Bson;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.mongodb.client.model.Aggregates.match;
import static com.mongodb.client.model.Aggregates.project;
import static com.mongodb.client.model.Filters.in;

/**
 * Translates a {@link SessionConfiguration} into a {@link Subscription}. Has no side effects.
 */
public final class SubscriptionBuilder {

    private SubscriptionBuilder() {
    }

    /**
     * @param loadedToken the checkpoint loaded for this session, takes precedence over any configured position
     */
    public static Subscription build(SessionConfiguration config, @Nullable ResumeToken loadedToken) {
        return new Subscription(pipeline(config), options(config, loadedToken));
    }

    /**
     * Filters come before the projection so that they can reference fields the projection drops.
     */
    static List<Bson> pipeline(SessionConfiguration config) {
        var pipeline = new ArrayList<Bson>();

        if (!config.getOperationTypes().isEmpty()) {
            var operationTypes = config.getOperationTypes().stream().map(OperationKind::value).toList();
            pipeline.add(match(in("operationType", operationTypes)));
        }

        if (!config.getMatchFilter().isEmpty()) {
            pipeline.add(match(config.getMatchFilter()));
        }

        if (!config.getProjection().isEmpty()) {
            pipeline.add(project(config.getProjection()));
        }

        return pipeline;
    }

    static StreamOptions options(SessionConfiguration config, @Nullable ResumeToken loadedToken) {
        ResumeToken token = loadedToken != null ? loadedToken : config.getResumeAfter();
        BsonDocument resumeAfter = token == null ? null : token.asBsonDocument();
        BsonTimestamp startAt = resumeAfter == null ? toOperationTime(config.getStartAtOperationTime()) : null;

        return new StreamOptions(
                config.getFullDocument().toFullDocument(),
                config.getBatchSize(),
                config.getMaxAwaitTime(),
                resumeAfter,
                startAt);
    }

    @Nullable
    static BsonTimestamp toOperationTime(@Nullable Instant instant) {
        return instant == null ? null : new BsonTimestamp((int) instant.getEpochSecond(), 0);
    }
}
