package com.mongodb.csm.model;

import com.mongodb.client.model.changestream.FullDocument;

import javax.annotation.Nullable;

public enum FullDocumentMode implements WireValue {
    DEFAULT("default", null),
    UPDATE_LOOKUP("updateLookup", FullDocument.UPDATE_LOOKUP),
    WHEN_AVAILABLE("whenAvailable", FullDocument.WHEN_AVAILABLE),
    REQUIRED("required", FullDocument.REQUIRED);

    private final String value;
    private final @Nullable FullDocument fullDocument;

    FullDocumentMode(String value, @Nullable FullDocument fullDocument) {
        this.value = value;
        this.fullDocument = fullDocument;
    }

    @Override
    public String value() {
        return value;
    }

    /**
     * @return the driver option, or {@code null} for {@link #DEFAULT} so that the server default is kept
     */
    @Nullable
    public FullDocument toFullDocument() {
        return fullDocument;
    }

    public static FullDocumentMode fromValue(String value) {
        return WireValue.fromValue(FullDocumentMode.class, value);
    }
}
