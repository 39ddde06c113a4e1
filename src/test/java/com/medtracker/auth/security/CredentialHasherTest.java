package com.medtracker.auth.security;

import com.medtracker.auth.exception.PasswordTooLongException;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialHasherTest {

    private final CredentialHasher hasher = new CredentialHasher(new BCryptPasswordEncoder(4));

    @Test
    void hash_then_verify_should_accept_same_password_only() {
        String hash = hasher.hash("Passw0rd");

        assertThat(hash).isNotEqualTo("Passw0rd");
        assertThat(hasher.verify("Passw0rd", hash)).isTrue();
        assertThat(hasher.verify("Passw0rd!", hash)).isFalse();
        assertThat(hasher.verify("passw0rd", hash)).isFalse();
    }

    @Test
    void hash_should_be_salted() {
        assertThat(hasher.hash("Passw0rd")).isNotEqualTo(hasher.hash("Passw0rd"));
    }

    @Test
    void hash_should_accept_exactly_72_bytes_and_reject_73() {
        String max = "a".repeat(71) + "1";
        assertThat(hasher.verify(max, hasher.hash(max))).isTrue();

        assertThatThrownBy(() -> hasher.hash("a".repeat(72) + "1"))
                .isInstanceOf(PasswordTooLongException.class);
    }

    @Test
    void byte_limit_should_count_utf8_bytes_not_characters() {
        // 25 three-byte characters = 75 bytes
        String multiByte = "€".repeat(25);
        assertThat(multiByte.length()).isEqualTo(25);
        assertThat(CredentialHasher.byteLength(multiByte)).isEqualTo(75);

        assertThatThrownBy(() -> hasher.hash(multiByte))
                .isInstanceOf(PasswordTooLongException.class);
    }

    @Test
    void verify_should_fail_closed_on_garbage_input() {
        String hash = hasher.hash("Passw0rd");

        assertThat(hasher.verify("Passw0rd", "not-a-bcrypt-hash")).isFalse();
        assertThat(hasher.verify("Passw0rd", "")).isFalse();
        assertThat(hasher.verify("Passw0rd", null)).isFalse();
        assertThat(hasher.verify(null, hash)).isFalse();
        assertThat(hasher.verify("x".repeat(100), hash)).isFalse();
    }
}
