package com.facet.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class PinPolicyTest {

    @Test
    void acceptsReasonablePin() {
        assertThat(PinPolicy.validateAndReason("482917", 6)).isNull();
        assertThat(PinPolicy.isAcceptable("7391-bench", 6)).isTrue();
    }

    @Test
    void rejectsShortPin() {
        assertThat(PinPolicy.validateAndReason("48291", 6)).isEqualTo("PIN must be at least 6 characters");
    }

    @Test
    void rejectsBlankAndMissingPin() {
        assertThat(PinPolicy.validateAndReason(null, 6)).isEqualTo("PIN is required");
        assertThat(PinPolicy.validateAndReason("       ", 6)).isEqualTo("PIN is required");
    }

    @Test
    void rejectsSurroundingWhitespace() {
        assertThat(PinPolicy.isAcceptable(" 482917", 6)).isFalse();
        assertThat(PinPolicy.isAcceptable("482917 ", 6)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"123456", "000000", "PASSWORD", "Password1", "changeme!", "1234567", "qwerty99"})
    void rejectsWeakPins(String pin) {
        assertThat(PinPolicy.validateAndReason(pin, 6)).isEqualTo("PIN is too easy to guess");
    }

    @Test
    void rejectsSingleRepeatedCharacter() {
        assertThat(PinPolicy.validateAndReason("zzzzzzz", 6)).isEqualTo("PIN must not repeat a single character");
    }
}
