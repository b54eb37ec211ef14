package com.mongodb.csm.model;

public enum OperationKind implements WireValue {
    INSERT("insert"),
    UPDATE("update"),
    DELETE("delete"),
    REPLACE("replace");

    private final String value;

    OperationKind(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static OperationKind fromValue(String value) {
        return WireValue.fromValue(OperationKind.class, value);
    }
}
