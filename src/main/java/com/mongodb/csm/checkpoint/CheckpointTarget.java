package com.mongodb.csm.checkpoint;

import javax.annotation.Nullable;

/**
 * The resolved location of a session's checkpoint record.
 */
public record CheckpointTarget(String database, String collection, String key, SaveFrequency saveFrequency) {

    static final String COLLECTION_SUFFIX = "_resume_tokens";

    /**
     * {@code <database>.<collection>}, or {@code <database>.*} when a whole database or deployment is watched.
     */
    public static String deriveKey(@Nullable String database, @Nullable String collection) {
        String db = database == null || database.isBlank() ? "default" : database;
        String coll = collection == null || collection.isBlank() ? "*" : collection;
        return db + "." + coll;
    }

    public static String defaultCollection(String database, @Nullable String watchedCollection) {
        return (watchedCollection == null || watchedCollection.isBlank() ? database : watchedCollection) + COLLECTION_SUFFIX;
    }
}
