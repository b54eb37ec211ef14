package com.mongodb.csm.converters;

import org.bson.BsonInvalidOperationException;
import org.bson.Document;
import org.bson.json.JsonParseException;
import picocli.CommandLine;

/**
 * Parses extended JSON, e.g. {@code {"fullDocument.status": "active"}}.
 */
public class JsonDocumentConverter implements CommandLine.ITypeConverter<Document> {
    @Override
    public Document convert(String s) throws Exception {
        if (s == null || s.isBlank()) {
            return new Document();
        }
        try {
            return Document.parse(s);
        } catch (JsonParseException | BsonInvalidOperationException e) {
            throw new CommandLine.TypeConversionException("Invalid JSON document '" + s + "': " + e.getMessage());
        }
    }
}
