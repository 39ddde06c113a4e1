package com.medtracker.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import java.time.Clock;

/**
 * Main application class for the Authentication Gateway.
 *
 * This service handles:
 * - Cookie-backed sessions for login, registration and demo access
 * - Bearer token issuance for legacy clients
 * - Brute-force defenses (rate limiting, account lockout, duplicate submission guard)
 */
@Slf4j
@SpringBootApplication
@EnableAsync
@EnableTransactionManagement
@ConfigurationPropertiesScan("com.medtracker.auth.config")
public class AuthGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthGatewayApplication.class, args);
        log.info("===========================================");
        log.info("Medical Tracker Authentication Gateway Started");
        log.info("===========================================");
        log.info("Authentication Surfaces:");
        log.info("- Session cookie (primary)");
        log.info("- Bearer JWT (legacy)");
        log.info("===========================================");
        log.info("Security Features:");
        log.info("- Per-key rate limiting");
        log.info("- Account lockout after repeated failures");
        log.info("- Duplicate submission guard");
        log.info("===========================================");
    }

    /**
     * Password encoder bean using BCrypt algorithm.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(12);
    }

    /**
     * Single time source for lockout, session and token arithmetic.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
