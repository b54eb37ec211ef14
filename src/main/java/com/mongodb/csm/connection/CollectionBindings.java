package com.mongodb.csm.connection;

import com.mongodb.MongoException;
import com.mongodb.MongoNamespace;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Get-or-create access to the collections used over one connection. Asking twice for the same namespace
 * returns the same binding, and a unique index is only requested the first time.
 */
public class CollectionBindings {
    private static final Logger logger = LoggerFactory.getLogger(CollectionBindings.class);

    private final Supplier<MongoClient> client;
    private final ConcurrentMap<MongoNamespace, MongoCollection<Document>> collections = new ConcurrentHashMap<>();
    private final Set<MongoNamespace> indexed = ConcurrentHashMap.newKeySet();

    public CollectionBindings(Supplier<MongoClient> client) {
        this.client = client;
    }

    public MongoCollection<Document> collection(String database, String collection) {
        return collections.computeIfAbsent(new MongoNamespace(database, collection),
                ns -> client.get().getDatabase(ns.getDatabaseName()).getCollection(ns.getCollectionName()));
    }

    /**
     * Returns the binding and makes sure {@code field} carries a unique index. A failing index creation
     * (for example missing privileges) is logged and not retried.
     */
    public MongoCollection<Document> uniquelyIndexedCollection(String database, String collection, String field) {
        var binding = collection(database, collection);
        var namespace = new MongoNamespace(database, collection);
        if (indexed.add(namespace)) {
            try {
                binding.createIndex(Indexes.ascending(field), new IndexOptions().unique(true).name(field + "_unique"));
                logger.debug("Ensured unique index on '{}' in {}", field, namespace);
            } catch (MongoException e) {
                logger.warn("Could not create unique index on '{}' in {}: {}", field, namespace, e.getMessage());
            }
        }
        return binding;
    }
}
