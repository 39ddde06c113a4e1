package com.medtracker.auth.util;

import jakarta.validation.Validator;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Canonical email form used for every account lookup and write. Format is
 * checked with the Bean Validation {@link Email} constraint.
 */
@Component
@RequiredArgsConstructor
public class EmailNormalizer {

    private final Validator validator;

    /**
     * Trim, lower-case and validate.
     *
     * @throws IllegalArgumentException if the result is not a plausible address
     */
    public String normalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Email is required");
        }
        String email = raw.trim().toLowerCase(Locale.ROOT);
        if (!validator.validateValue(EmailAddress.class, "value", email).isEmpty()) {
            throw new IllegalArgumentException("Invalid email format");
        }
        return email;
    }

    static class EmailAddress {

        // The domain must carry a dot, as registrable addresses do
        @NotBlank
        @Size(max = 255)
        @Email(regexp = ".+@[^@]+\\.[^@.]+$")
        String value;
    }
}
