package com.mongodb.csm.checkpoint;

import com.mongodb.csm.checkpoint.SaveFrequency.Decision;
import com.mongodb.csm.exceptions.ConfigurationException;
import com.mongodb.csm.model.ResumeToken;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SaveFrequencyTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private static final ResumeToken T1 = ResumeToken.fromString("{\"_data\": \"T1\"}");
    private static final ResumeToken T2 = ResumeToken.fromString("{\"_data\": \"T2\"}");

    @Test
    void everyChangeAlwaysSaves() {
        var state = CheckpointState.initial(T1);

        assertThat(SaveFrequency.everyChange().shouldSave(state, T1, NOW)).isEqualTo(Decision.SAVE);
    }

    @Test
    void smartSkipsTheTokenItResumedFrom() {
        var state = CheckpointState.initial(T1);

        assertThat(SaveFrequency.smart().shouldSave(state, T1, NOW)).isEqualTo(Decision.SKIP);
        assertThat(SaveFrequency.smart().shouldSave(state, T2, NOW)).isEqualTo(Decision.SAVE);
    }

    @Test
    void smartTreatsARawStringCheckpointAsTheSameToken() {
        var state = CheckpointState.initial(ResumeToken.fromString("8263AB"));
        var fromCursor = ResumeToken.of(new BsonDocument("_data", new BsonString("8263AB")));

        assertThat(SaveFrequency.smart().shouldSave(state, fromCursor, NOW)).isEqualTo(Decision.SKIP);
    }

    @Test
    void smartSkipsOnlyAfterTheWriteSucceeded() {
        var state = CheckpointState.initial(null);

        assertThat(SaveFrequency.smart().shouldSave(state, T1, NOW)).isEqualTo(Decision.SAVE);
        state.markSaved(T1, NOW);
        assertThat(SaveFrequency.smart().shouldSave(state, T1, NOW)).isEqualTo(Decision.SKIP);
    }

    @Test
    void throttledSavesAtMostOncePerInterval() {
        var frequency = SaveFrequency.throttled(Duration.ofSeconds(5));
        var state = CheckpointState.initial(null);

        assertThat(frequency.shouldSave(state, T1, NOW)).isEqualTo(Decision.SAVE);
        state.markSaved(T1, NOW);

        assertThat(frequency.shouldSave(state, T2, NOW.plusSeconds(1))).isEqualTo(Decision.SKIP);
        assertThat(frequency.shouldSave(state, T2, NOW.plusMillis(4999))).isEqualTo(Decision.SKIP);
        assertThat(frequency.shouldSave(state, T2, NOW.plusSeconds(5))).isEqualTo(Decision.SAVE);
    }

    @Test
    void parsesKnownValuesAndTheLegacyAlias() {
        assertThat(SaveFrequency.parse("every_change")).isSameAs(SaveFrequency.everyChange());
        assertThat(SaveFrequency.parse("smart")).isSameAs(SaveFrequency.smart());
        assertThat(SaveFrequency.parse("throttled_5s").value()).isEqualTo("throttled");
        assertThatThrownBy(() -> SaveFrequency.parse("sometimes")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void throttleIntervalMustBePositive() {
        assertThatThrownBy(() -> SaveFrequency.throttled(Duration.ZERO)).isInstanceOf(ConfigurationException.class);
    }
}
