package com.mongodb.csm.logging;

import java.util.Objects;

/**
 * Per-session debug logging. When disabled no per-event debug line is written regardless of the samplers.
 *
 * @param debugEnabled whether debug logging is on for the session
 * @param events       sampler for processed change events
 * @param tokenChanges sampler for resume token changes
 * @param skippedSaves sampler for checkpoint saves skipped by the save frequency
 */
public record DebugSettings(boolean debugEnabled, LogSampler events, LogSampler tokenChanges, LogSampler skippedSaves) {

    public DebugSettings {
        Objects.requireNonNull(events, "events sampler cannot be null");
        Objects.requireNonNull(tokenChanges, "tokenChanges sampler cannot be null");
        Objects.requireNonNull(skippedSaves, "skippedSaves sampler cannot be null");
    }

    public static DebugSettings disabled() {
        return new DebugSettings(false, LogSampler.everyNth(10), LogSampler.everyNth(20), LogSampler.everyNth(100));
    }

    public static DebugSettings enabled() {
        return new DebugSettings(true, LogSampler.everyNth(10), LogSampler.everyNth(20), LogSampler.everyNth(100));
    }

    public boolean logEvent() {
        return debugEnabled && events.sample();
    }

    public boolean logTokenChange() {
        return debugEnabled && tokenChanges.sample();
    }

    public boolean logSkippedSave() {
        return debugEnabled && skippedSaves.sample();
    }
}
