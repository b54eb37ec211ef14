package com.mongodb.csm.checkpoint;

public enum SaveOutcome {
    SAVED, SKIPPED
}
