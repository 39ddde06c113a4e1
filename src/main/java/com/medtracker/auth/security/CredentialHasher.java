package com.medtracker.auth.security;

import com.medtracker.auth.exception.PasswordTooLongException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Salted, deliberately slow password hashing backed by the BCrypt
 * {@link PasswordEncoder}. Inputs above 72 UTF-8 bytes are rejected, never truncated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;

    public String hash(String password) {
        requireWithinLimit(password);
        return passwordEncoder.encode(password);
    }

    /**
     * Fails closed: any error while verifying yields {@code false}.
     */
    public boolean verify(String password, String hash) {
        if (password == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            requireWithinLimit(password);
            return passwordEncoder.matches(password, hash);
        } catch (Exception e) {
            log.warn("Credential verification failed: {}", e.getClass().getSimpleName());
            return false;
        }
    }

    public static int byteLength(String password) {
        return password.getBytes(StandardCharsets.UTF_8).length;
    }

    private static void requireWithinLimit(String password) {
        int length = byteLength(password);
        if (length > MAX_PASSWORD_BYTES) {
            throw new PasswordTooLongException(length);
        }
    }
}
