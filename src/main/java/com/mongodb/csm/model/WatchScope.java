package com.mongodb.csm.model;

/**
 * Granularity of a change stream.
 */
public enum WatchScope implements WireValue {
    COLLECTION("collection"),
    DATABASE("database"),
    DEPLOYMENT("deployment");

    private final String value;

    WatchScope(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static WatchScope fromValue(String value) {
        return WireValue.fromValue(WatchScope.class, value);
    }
}
