package com.mongodb.csm.model;

import com.mongodb.csm.checkpoint.CheckpointConfiguration;
import com.mongodb.csm.checkpoint.SaveFrequency;
import com.mongodb.csm.exceptions.ConfigurationException;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionConfigurationTest {

    @Test
    void defaultsWatchAllOperationTypesOfACollection() {
        var config = SessionConfiguration.builder().database("shop").collection("orders").build();

        assertThat(config.getScope()).isEqualTo(WatchScope.COLLECTION);
        assertThat(config.getOperationTypes()).containsExactlyInAnyOrder(OperationKind.values());
        assertThat(config.getFullDocument()).isEqualTo(FullDocumentMode.DEFAULT);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.FULL);
        assertThat(config.getBatchSize()).isEqualTo(100);
        assertThat(config.getMaxAwaitTime()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getCheckpoint().isEnabled()).isFalse();
        assertThat(config.describeTarget()).isEqualTo("collection shop.orders");
    }

    @Test
    void collectionIsRequiredForCollectionScope() {
        assertThatThrownBy(() -> SessionConfiguration.builder().database("shop").build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Collection name is required");
    }

    @Test
    void databaseScopeNeedsNoCollection() {
        var config = SessionConfiguration.builder().scope(WatchScope.DATABASE).database("shop").build();

        assertThat(config.getCollection()).isNull();
        assertThat(config.describeTarget()).isEqualTo("database shop");
    }

    @Test
    void emptyOperationTypesAreRejected() {
        var builder = SessionConfiguration.builder().database("shop").collection("orders").operationTypes(List.of());

        assertThatThrownBy(builder::build)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("operation type");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void batchSizeMustBePositive(int batchSize) {
        var builder = SessionConfiguration.builder().database("shop").collection("orders").batchSize(batchSize);

        assertThatThrownBy(builder::build).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invalidDatabaseNameIsRejected() {
        var builder = SessionConfiguration.builder().database("sh op").collection("orders");

        assertThatThrownBy(builder::build).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invalidCheckpointNamespaceIsRejectedBeforeConnecting() {
        var badDatabase = SessionConfiguration.builder().database("shop").collection("orders")
                .checkpoint(CheckpointConfiguration.enabled(null, "bad.db", null, SaveFrequency.smart()));
        var badCollection = SessionConfiguration.builder().database("shop").collection("orders")
                .checkpoint(CheckpointConfiguration.enabled("bad$tokens", null, null, SaveFrequency.smart()));

        assertThatThrownBy(badDatabase::build).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(badCollection::build).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void filterAndProjectionCannotBeChangedFromOutside() {
        var filter = new Document("fullDocument.status", "active");
        var config = SessionConfiguration.builder().database("shop").collection("orders").matchFilter(filter).build();

        filter.put("other", 1);
        config.getMatchFilter().put("more", 2);

        assertThat(config.getMatchFilter()).isEqualTo(new Document("fullDocument.status", "active"));
    }

    @Test
    void wireValuesParseToEnums() {
        assertThat(FullDocumentMode.fromValue("updateLookup")).isEqualTo(FullDocumentMode.UPDATE_LOOKUP);
        assertThat(OutputFormat.fromValue("simplified")).isEqualTo(OutputFormat.SIMPLIFIED);
        assertThatThrownBy(() -> WatchScope.fromValue("cluster"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("collection, database, deployment");
    }
}
