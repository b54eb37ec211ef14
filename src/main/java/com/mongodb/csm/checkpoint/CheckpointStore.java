package com.mongodb.csm.checkpoint;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.UpdateResult;
import com.mongodb.csm.checkpoint.SaveFrequency.Decision;
import com.mongodb.csm.connection.ConnectionHandle;
import com.mongodb.csm.exceptions.CheckpointWriteException;
import com.mongodb.csm.logging.DebugSettings;
import com.mongodb.csm.model.ResumeToken;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

import static com.mongodb.client.model.Filters.eq;

/**
 * Persists resume tokens as one {@code {key, token, updatedAt}} document per key.
 * <p>
 * Saving is best-effort: a failed write is logged and reported as {@link SaveOutcome#SKIPPED}. Losing a
 * checkpoint only means some events are delivered again after the next resume.
 */
public class CheckpointStore {
    static final String KEY = "key";
    static final String TOKEN = "token";
    static final String UPDATED_AT = "updatedAt";

    private static final ReplaceOptions tokenUpdateOptions = new ReplaceOptions().upsert(true);

    private final Logger logger = LoggerFactory.getLogger(CheckpointStore.class);
    private final Clock clock;
    private final DebugSettings debug;

    public CheckpointStore() {
        this(Clock.systemUTC(), DebugSettings.disabled());
    }

    public CheckpointStore(Clock clock, DebugSettings debug) {
        this.clock = clock;
        this.debug = debug;
    }

    /**
     * @return the stored token, or empty when there is none (first run) or it cannot be read
     */
    public Optional<ResumeToken> load(ConnectionHandle handle, String database, String collection, String key) {
        try {
            Document saved = collection(handle, database, collection).find(eq(KEY, key)).first();
            if (saved == null || saved.get(TOKEN) == null) {
                logger.debug("No saved resume token found in {}.{} for key '{}' (first run)", database, collection, key);
                return Optional.empty();
            }
            var token = ResumeToken.fromStored(saved.get(TOKEN));
            logger.info("Loaded resume token for key '{}' from {}.{}", key, database, collection);
            return Optional.of(token);
        } catch (RuntimeException e) {
            logger.error("Error loading resume token '{}' from {}.{}", key, database, collection, e);
            return Optional.empty();
        }
    }

    public SaveOutcome save(ConnectionHandle handle,
                            String database,
                            String collection,
                            String key,
                            ResumeToken token,
                            SaveFrequency frequency,
                            CheckpointState state) {
        Instant now = clock.instant();
        if (frequency.shouldSave(state, token, now) == Decision.SKIP) {
            if (debug.logSkippedSave()) {
                logger.debug("Resume token save skipped ({}) for key '{}'", frequency, key);
            }
            return SaveOutcome.SKIPPED;
        }

        try {
            UpdateResult result = upsert(handle, database, collection, key, token, now);
            if (result.getUpsertedId() != null) {
                logger.info("Resume token initialized in {}.{} for key '{}'", database, collection, key);
            }
        } catch (CheckpointWriteException e) {
            logger.error(e.getMessage(), e);
            return SaveOutcome.SKIPPED;
        }

        state.markSaved(token, now);
        return SaveOutcome.SAVED;
    }

    private UpdateResult upsert(ConnectionHandle handle, String database, String collection, String key, ResumeToken token, Instant now) {
        var tokenDoc = new Document();
        tokenDoc.put(KEY, key);
        tokenDoc.put(TOKEN, token.asBsonDocument());
        tokenDoc.put(UPDATED_AT, Date.from(now));
        try {
            return collection(handle, database, collection).replaceOne(eq(KEY, key), tokenDoc, tokenUpdateOptions);
        } catch (RuntimeException e) {
            // also covers binding failures such as an invalid namespace
            throw new CheckpointWriteException(key, e);
        }
    }

    private MongoCollection<Document> collection(ConnectionHandle handle, String database, String collection) {
        return handle.bindings().uniquelyIndexedCollection(database, collection, KEY);
    }
}
