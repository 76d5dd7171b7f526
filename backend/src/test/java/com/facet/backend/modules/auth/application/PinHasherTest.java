package com.facet.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;

class PinHasherTest {

    private PinHasher pinHasher;

    @BeforeEach
    void setUp() {
        pinHasher = new PinHasher(Argon2PasswordEncoder.defaultsForSpringSecurity_v5_8());
    }

    @Test
    void hashIsSaltedAndVerifiable() {
        String first = pinHasher.hash("482917");
        String second = pinHasher.hash("482917");

        assertThat(first).startsWith("$argon2id$").isNotEqualTo(second);
        assertThat(pinHasher.verify("482917", first)).isTrue();
        assertThat(pinHasher.verify("482917", second)).isTrue();
        assertThat(pinHasher.verify("482918", first)).isFalse();
    }

    @Test
    void verifyFailsClosedOnMissingOrMalformedHash() {
        assertThat(pinHasher.verify("482917", null)).isFalse();
        assertThat(pinHasher.verify("482917", "  ")).isFalse();
        assertThat(pinHasher.verify("482917", "not-a-hash")).isFalse();
        assertThat(pinHasher.verify("482917", "$argon2id$v=19$broken")).isFalse();
        assertThat(pinHasher.verify(null, pinHasher.hash("482917"))).isFalse();
    }

    @Test
    void refusesToHashEmptyPin() {
        assertThatThrownBy(() -> pinHasher.hash(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
