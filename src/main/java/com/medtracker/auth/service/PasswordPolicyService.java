package com.medtracker.auth.service;

import com.medtracker.auth.config.AuthProperties;
import com.medtracker.auth.exception.ValidationFailureException;
import com.medtracker.auth.security.CredentialHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.passay.*;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Password policy: minimum length, at least one letter and one digit, no whitespace.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordPolicyService {

    public static final String PASSWORD_TOO_SHORT = "PASSWORD_TOO_SHORT";
    public static final String PASSWORD_TOO_LONG = "PASSWORD_TOO_LONG";
    public static final String PASSWORD_WEAK = "PASSWORD_WEAK";

    private static final int MAX_LENGTH = 128;

    private final AuthProperties authProperties;

    public PasswordValidationResult validate(String password) {
        if (password == null || password.isEmpty()) {
            return PasswordValidationResult.rejected(PASSWORD_TOO_SHORT, List.of("Password is required"));
        }
        if (CredentialHasher.byteLength(password) > CredentialHasher.MAX_PASSWORD_BYTES) {
            return PasswordValidationResult.rejected(PASSWORD_TOO_LONG,
                    List.of("Password must be at most " + CredentialHasher.MAX_PASSWORD_BYTES + " bytes"));
        }

        List<Rule> rules = new ArrayList<>();
        rules.add(new LengthRule(authProperties.getPassword().getMinLength(), MAX_LENGTH));
        rules.add(new CharacterRule(EnglishCharacterData.Alphabetical, 1));
        rules.add(new CharacterRule(EnglishCharacterData.Digit, 1));
        rules.add(new WhitespaceRule());

        PasswordValidator validator = new PasswordValidator(rules);
        RuleResult result = validator.validate(new PasswordData(password));
        if (result.isValid()) {
            return PasswordValidationResult.builder().valid(true).messages(List.of()).build();
        }

        boolean tooShort = result.getDetails().stream()
                .anyMatch(d -> LengthRule.ERROR_CODE_MIN.equals(d.getErrorCode()));
        return PasswordValidationResult.rejected(
                tooShort ? PASSWORD_TOO_SHORT : PASSWORD_WEAK,
                validator.getMessages(result));
    }

    /**
     * @throws ValidationFailureException carrying the reason code
     */
    public void requireValid(String password) {
        PasswordValidationResult result = validate(password);
        if (!result.isValid()) {
            log.debug("Password rejected: {}", result.getMessages());
            throw new ValidationFailureException(result.getReason());
        }
    }

    @lombok.Data
    @lombok.Builder
    public static class PasswordValidationResult {
        private boolean valid;
        private String reason;
        private List<String> messages;

        static PasswordValidationResult rejected(String reason, List<String> messages) {
            return PasswordValidationResult.builder()
                    .valid(false)
                    .reason(reason)
                    .messages(messages)
                    .build();
        }
    }
}
