package com.mongodb.csm.pipeline;

import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.TruncatedArray;
import com.mongodb.client.model.changestream.UpdateDescription;
import org.bson.Document;

import javax.annotation.Nullable;

/**
 * Converts driver change events back into their document form.
 */
public final class ChangeEvents {

    private ChangeEvents() {
    }

    /**
     * The whole event, including fields a {@code $project} stage added.
     */
    public static Document toDocument(ChangeStreamDocument<Document> event) {
        var doc = new Document();
        putIfNotNull(doc, "_id", event.getResumeToken());
        putIfNotNull(doc, "operationType", event.getOperationTypeString());
        putIfNotNull(doc, "clusterTime", event.getClusterTime());
        putIfNotNull(doc, "wallTime", event.getWallTime());
        putIfNotNull(doc, "ns", event.getNamespaceDocument());
        putIfNotNull(doc, "to", event.getDestinationNamespaceDocument());
        putIfNotNull(doc, "documentKey", event.getDocumentKey());
        putIfNotNull(doc, "fullDocument", event.getFullDocument());
        putIfNotNull(doc, "fullDocumentBeforeChange", event.getFullDocumentBeforeChange());
        putIfNotNull(doc, "updateDescription", toDocument(event.getUpdateDescription()));
        putIfNotNull(doc, "txnNumber", event.getTxnNumber());
        putIfNotNull(doc, "lsid", event.getLsid());
        if (event.getExtraElements() != null) {
            doc.putAll(event.getExtraElements());
        }
        return doc;
    }

    @Nullable
    public static Document toDocument(@Nullable UpdateDescription updateDescription) {
        if (updateDescription == null) {
            return null;
        }
        var doc = new Document();
        putIfNotNull(doc, "updatedFields", updateDescription.getUpdatedFields());
        putIfNotNull(doc, "removedFields", updateDescription.getRemovedFields());
        if (updateDescription.getTruncatedArrays() != null && !updateDescription.getTruncatedArrays().isEmpty()) {
            doc.put("truncatedArrays", updateDescription.getTruncatedArrays().stream()
                    .map(ChangeEvents::toDocument)
                    .toList());
        }
        return doc;
    }

    private static Document toDocument(TruncatedArray truncatedArray) {
        return new Document("field", truncatedArray.getField()).append("newSize", truncatedArray.getNewSize());
    }

    private static void putIfNotNull(Document doc, String key, @Nullable Object value) {
        if (value != null) {
            doc.put(key, value);
        }
    }
}
