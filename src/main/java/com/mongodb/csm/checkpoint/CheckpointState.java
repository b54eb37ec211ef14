package com.mongodb.csm.checkpoint;

import com.mongodb.csm.model.ResumeToken;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * What a session last wrote to its checkpoint. Only the session's worker updates it.
 */
public class CheckpointState {

    private volatile @Nullable String lastSavedToken;
    private volatile @Nullable Instant lastSaveTime;

    private CheckpointState(@Nullable String lastSavedToken) {
        this.lastSavedToken = lastSavedToken;
    }

    /**
     * @param loaded the token the session resumed from, so that re-reading it does not trigger a write
     */
    public static CheckpointState initial(@Nullable ResumeToken loaded) {
        return new CheckpointState(loaded == null ? null : comparable(loaded));
    }

    @Nullable
    public String lastSavedToken() {
        return lastSavedToken;
    }

    @Nullable
    public Instant lastSaveTime() {
        return lastSaveTime;
    }

    /**
     * A raw {@code "8263..."} token and the cursor's {@code {"_data": "8263..."}} compare equal.
     */
    static String comparable(ResumeToken token) {
        return token.asBsonDocument().toJson();
    }

    void markSaved(ResumeToken token, Instant time) {
        this.lastSavedToken = comparable(token);
        this.lastSaveTime = time;
    }
}
