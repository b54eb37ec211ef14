package com.mongodb.csm.checkpoint;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Where and how often resume tokens are persisted. Blank names mean "derive from the watched namespace".
 */
public class CheckpointConfiguration {

    private static final CheckpointConfiguration DISABLED = new CheckpointConfiguration(false, null, null, null, SaveFrequency.smart());

    private final boolean enabled;
    private final @Nullable String collection;
    private final @Nullable String database;
    private final @Nullable String key;
    private final SaveFrequency saveFrequency;

    private CheckpointConfiguration(boolean enabled,
                                    @Nullable String collection,
                                    @Nullable String database,
                                    @Nullable String key,
                                    SaveFrequency saveFrequency) {
        this.enabled = enabled;
        this.collection = blankToNull(collection);
        this.database = blankToNull(database);
        this.key = blankToNull(key);
        this.saveFrequency = Objects.requireNonNull(saveFrequency, "saveFrequency cannot be null");
    }

    public static CheckpointConfiguration disabled() {
        return DISABLED;
    }

    public static CheckpointConfiguration enabled(SaveFrequency saveFrequency) {
        return new CheckpointConfiguration(true, null, null, null, saveFrequency);
    }

    public static CheckpointConfiguration enabled(@Nullable String collection,
                                                  @Nullable String database,
                                                  @Nullable String key,
                                                  SaveFrequency saveFrequency) {
        return new CheckpointConfiguration(true, collection, database, key, saveFrequency);
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Nullable
    public String getCollection() {
        return collection;
    }

    @Nullable
    public String getDatabase() {
        return database;
    }

    @Nullable
    public String getKey() {
        return key;
    }

    public SaveFrequency getSaveFrequency() {
        return saveFrequency;
    }

    /**
     * Fills in the defaults for the watched namespace. The result is computed once per session.
     */
    public CheckpointTarget resolve(String sessionDatabase, @Nullable String watchedCollection) {
        String resolvedCollection = collection != null ? collection : CheckpointTarget.defaultCollection(sessionDatabase, watchedCollection);
        String resolvedDatabase = database != null ? database : sessionDatabase;
        // a key of "default" means it was never set
        String resolvedKey = key != null && !key.equals("default") ? key : CheckpointTarget.deriveKey(sessionDatabase, watchedCollection);
        return new CheckpointTarget(resolvedDatabase, resolvedCollection, resolvedKey, saveFrequency);
    }

    private static String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return enabled ? "CheckpointConfiguration{collection=" + collection + ", database=" + database +
                ", key=" + key + ", saveFrequency=" + saveFrequency + "}" : "CheckpointConfiguration{disabled}";
    }
}
