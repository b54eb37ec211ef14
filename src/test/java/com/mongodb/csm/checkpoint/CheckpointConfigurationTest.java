package com.mongodb.csm.checkpoint;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CheckpointConfigurationTest {

    @Test
    void defaultsAreDerivedFromTheWatchedCollection() {
        var target = CheckpointConfiguration.enabled(SaveFrequency.smart()).resolve("shop", "orders");

        assertThat(target.database()).isEqualTo("shop");
        assertThat(target.collection()).isEqualTo("orders_resume_tokens");
        assertThat(target.key()).isEqualTo("shop.orders");
        assertThat(target.saveFrequency()).isSameAs(SaveFrequency.smart());
    }

    @Test
    void wholeDatabaseUsesAWildcardKey() {
        var target = CheckpointConfiguration.enabled(SaveFrequency.smart()).resolve("shop", null);

        assertThat(target.collection()).isEqualTo("shop_resume_tokens");
        assertThat(target.key()).isEqualTo("shop.*");
    }

    @Test
    void defaultKeyValueMeansDerive() {
        var target = CheckpointConfiguration.enabled(null, null, "default", SaveFrequency.smart()).resolve("shop", "orders");

        assertThat(target.key()).isEqualTo("shop.orders");
    }

    @Test
    void explicitValuesWinAndBlanksAreIgnored() {
        var target = CheckpointConfiguration.enabled("tokens", "ops", "orders-monitor", SaveFrequency.everyChange())
                .resolve("shop", "orders");
        var blanks = CheckpointConfiguration.enabled(" ", "", null, SaveFrequency.everyChange())
                .resolve("shop", "orders");

        assertThat(target).isEqualTo(new CheckpointTarget("ops", "tokens", "orders-monitor", SaveFrequency.everyChange()));
        assertThat(blanks).isEqualTo(new CheckpointTarget("shop", "orders_resume_tokens", "shop.orders", SaveFrequency.everyChange()));
    }

    @Test
    void keyFallsBackToDefaultDatabase() {
        assertThat(CheckpointTarget.deriveKey(null, "orders")).isEqualTo("default.orders");
    }
}
