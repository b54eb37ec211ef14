package com.mongodb.csm.model;

import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonString;
import org.bson.Document;
import org.bson.json.JsonParseException;

import java.util.Objects;

/**
 * An opaque change stream position, kept in its serialized form.
 * <p>
 * Tokens come either as a structured document ({@code {"_data": "8263..."}}) or as the raw string. Both are
 * accepted: a value that does not parse as a JSON document is treated as the raw {@code _data} string.
 */
public final class ResumeToken {

    static final String DATA = "_data";

    private final String value;

    private ResumeToken(String value) {
        this.value = value;
    }

    public static ResumeToken of(BsonDocument token) {
        Objects.requireNonNull(token, "token cannot be null");
        return new ResumeToken(token.toJson());
    }

    public static ResumeToken fromString(String value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Resume token cannot be blank");
        }
        return new ResumeToken(value.trim());
    }

    /**
     * Converts a {@code token} field read from the checkpoint collection.
     */
    public static ResumeToken fromStored(Object stored) {
        if (stored instanceof String string) {
            return fromString(string);
        } else if (stored instanceof Document document) {
            return new ResumeToken(document.toJson());
        } else if (stored instanceof BsonDocument bsonDocument) {
            return of(bsonDocument);
        } else if (stored instanceof BsonString bsonString) {
            return fromString(bsonString.getValue());
        }
        throw new IllegalArgumentException("Unsupported resume token type " + (stored == null ? "null" : stored.getClass().getName()));
    }

    /**
     * @return the serialized form, used to tell whether two tokens are the same
     */
    public String asString() {
        return value;
    }

    public boolean isStructured() {
        return parse() != null;
    }

    /**
     * @return the token as the driver expects it for {@code resumeAfter}
     */
    public BsonDocument asBsonDocument() {
        BsonDocument parsed = parse();
        return parsed != null ? parsed : new BsonDocument(DATA, new BsonString(value));
    }

    private BsonDocument parse() {
        if (!value.startsWith("{")) {
            return null;
        }
        try {
            return BsonDocument.parse(value);
        } catch (JsonParseException | BsonInvalidOperationException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResumeToken that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
