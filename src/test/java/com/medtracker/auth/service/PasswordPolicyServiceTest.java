package com.medtracker.auth.service;

import com.medtracker.auth.exception.ValidationFailureException;
import com.medtracker.auth.service.PasswordPolicyService.PasswordValidationResult;
import com.medtracker.auth.testsupport.TestProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class PasswordPolicyServiceTest {

    private final PasswordPolicyService policy = new PasswordPolicyService(TestProperties.defaults());

    @Test
    void letters_and_digits_of_minimum_length_should_pass() {
        PasswordValidationResult result = policy.validate("abcdefg1");

        assertThat(result.isValid()).isTrue();
        assertThat(result.getReason()).isNull();
    }

    @Test
    void short_password_should_be_too_short() {
        assertThat(policy.validate("abc1").getReason()).isEqualTo(PasswordPolicyService.PASSWORD_TOO_SHORT);
        assertThat(policy.validate("").getReason()).isEqualTo(PasswordPolicyService.PASSWORD_TOO_SHORT);
        assertThat(policy.validate(null).getReason()).isEqualTo(PasswordPolicyService.PASSWORD_TOO_SHORT);
    }

    @Test
    void missing_letter_or_digit_should_be_weak() {
        assertThat(policy.validate("12345678").getReason()).isEqualTo(PasswordPolicyService.PASSWORD_WEAK);
        assertThat(policy.validate("abcdefgh").getReason()).isEqualTo(PasswordPolicyService.PASSWORD_WEAK);
        assertThat(policy.validate("abcd 1234").getReason()).isEqualTo(PasswordPolicyService.PASSWORD_WEAK);
    }

    @Test
    void password_over_72_bytes_should_be_too_long() {
        assertThat(policy.validate("a1".repeat(37)).getReason()).isEqualTo(PasswordPolicyService.PASSWORD_TOO_LONG);
        assertThat(policy.validate("a1".repeat(36)).isValid()).isTrue();
    }

    @Test
    void require_valid_should_throw_with_reason_code() {
        var ex = catchThrowableOfType(() -> policy.requireValid("short1"), ValidationFailureException.class);

        assertThat(ex.getErrorCode()).isEqualTo(PasswordPolicyService.PASSWORD_TOO_SHORT);
        assertThat(ex.getStatus().value()).isEqualTo(400);
        assertThatCode(() -> policy.requireValid("Passw0rd")).doesNotThrowAnyException();
    }
}
