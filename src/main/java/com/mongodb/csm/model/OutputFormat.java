package com.mongodb.csm.model;

/**
 * Shape of the records emitted for each change event.
 */
public enum OutputFormat implements WireValue {
    /**
     * The complete change event with all metadata.
     */
    FULL("full"),
    /**
     * Only the changed document, falling back to the document key.
     */
    DOCUMENT("document"),
    /**
     * Operation type, document key, document, update description and timestamp.
     */
    SIMPLIFIED("simplified");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static OutputFormat fromValue(String value) {
        return WireValue.fromValue(OutputFormat.class, value);
    }
}
