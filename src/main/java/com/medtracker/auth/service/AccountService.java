package com.medtracker.auth.service;

import com.medtracker.auth.config.AuthProperties;
import com.medtracker.auth.entity.Account;
import com.medtracker.auth.exception.EmailAlreadyRegisteredException;
import com.medtracker.auth.repository.AccountRepository;
import com.medtracker.auth.security.CredentialHasher;
import com.medtracker.auth.util.EmailMasker;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * Account lookup and creation. Callers pass emails already normalized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final AccountRepository accountRepository;
    private final CredentialHasher credentialHasher;
    private final AuthProperties authProperties;

    @Transactional(readOnly = true)
    public Optional<Account> findByEmail(String email) {
        return accountRepository.findByEmail(email);
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID id) {
        return accountRepository.findById(id);
    }

    /**
     * Create an account. A unique-index violation, including one from a
     * concurrent registration that passed the pre-check, becomes a conflict.
     */
    public Account create(String email, String password, AccountNames names) {
        if (accountRepository.existsByEmail(email)) {
            throw new EmailAlreadyRegisteredException();
        }

        Account account = Account.builder()
                .email(email)
                .passwordHash(credentialHasher.hash(password))
                .firstName(names.getFirstName())
                .lastName(names.getLastName())
                .displayName(names.getDisplayName())
                .build();

        try {
            account = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            log.info("Registration conflict for {}", EmailMasker.mask(email));
            throw new EmailAlreadyRegisteredException(e);
        }

        log.info("Account created: {} ({})", account.getId(), EmailMasker.mask(email));
        return account;
    }

    /**
     * Create-if-absent for the demo account. Its password is random and never disclosed.
     */
    public Account ensureDemoAccount() {
        AuthProperties.Demo demo = authProperties.getDemo();
        Optional<Account> existing = accountRepository.findByEmail(demo.getEmail());
        if (existing.isPresent()) {
            return existing.get();
        }

        try {
            return create(demo.getEmail(), randomPassword(), AccountNames.builder()
                    .firstName("Demo")
                    .lastName("User")
                    .displayName(demo.getDisplayName())
                    .build());
        } catch (EmailAlreadyRegisteredException e) {
            // Lost a creation race; the winner's row is the demo account
            return accountRepository.findByEmail(demo.getEmail())
                    .orElseThrow(() -> new IllegalStateException("Demo account missing after conflict", e));
        }
    }

    private static String randomPassword() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    @Getter
    @Builder
    public static class AccountNames {
        private final String firstName;
        private final String lastName;
        private final String displayName;
    }
}
