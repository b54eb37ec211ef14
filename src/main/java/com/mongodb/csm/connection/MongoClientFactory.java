package com.mongodb.csm.connection;

import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

@FunctionalInterface
public interface MongoClientFactory {

    MongoClient create(MongoClientSettings settings);

    static MongoClientFactory standard() {
        return MongoClients::create;
    }
}
