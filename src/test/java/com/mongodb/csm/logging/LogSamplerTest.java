package com.mongodb.csm.logging;

import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogSamplerTest {

    @Test
    void everyNthLetsEveryNthCallThrough() {
        LogSampler sampler = LogSampler.everyNth(3);

        var results = IntStream.range(0, 9).mapToObj(i -> sampler.sample()).toList();

        assertThat(results).containsExactly(false, false, true, false, false, true, false, false, true);
    }

    @Test
    void everyFirstAlwaysSamples() {
        LogSampler sampler = LogSampler.everyNth(1);

        assertThat(sampler.sample()).isTrue();
        assertThat(sampler.sample()).isTrue();
    }

    @Test
    void everyNthRejectsZero() {
        assertThatThrownBy(() -> LogSampler.everyNth(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void disabledDebugSettingsNeverLogRegardlessOfSamplers() {
        var debug = new DebugSettings(false, LogSampler.always(), LogSampler.always(), LogSampler.always());

        assertThat(debug.logEvent()).isFalse();
        assertThat(debug.logTokenChange()).isFalse();
        assertThat(debug.logSkippedSave()).isFalse();
    }

    @Test
    void enabledDebugSettingsSampleEveryTenthEvent() {
        var debug = DebugSettings.enabled();

        long logged = IntStream.range(0, 100).filter(i -> debug.logEvent()).count();

        assertThat(logged).isEqualTo(10);
    }
}
