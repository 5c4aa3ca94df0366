package com.openforge.fleetcore.config;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class StartupInfoRunnerTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "tvly-placeholder"})
    void missingKeysAreReportedAsNotSet(String key) {
        assertThat(StartupInfoRunner.maskKey(key)).isEqualTo("(not set)");
    }

    @ParameterizedTest
    @CsvSource({
            "tvly-short,                     ***",
            "tvly-abcdef1234567890wxyz,      tvly-a...wxyz"
    })
    void realKeysAreMasked(String key, String expected) {
        assertThat(StartupInfoRunner.maskKey(key)).isEqualTo(expected);
    }
}
