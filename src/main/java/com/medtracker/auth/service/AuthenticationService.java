package com.medtracker.auth.service;

import com.medtracker.auth.config.AuthProperties;
import com.medtracker.auth.dto.request.LoginRequest;
import com.medtracker.auth.dto.request.RegisterRequest;
import com.medtracker.auth.dto.response.AccountResponse;
import com.medtracker.auth.dto.response.CallerResponse;
import com.medtracker.auth.dto.response.DemoResponse;
import com.medtracker.auth.dto.response.LogoutResponse;
import com.medtracker.auth.dto.response.SessionResponse;
import com.medtracker.auth.dto.response.SessionStatusResponse;
import com.medtracker.auth.dto.response.TokenResponse;
import com.medtracker.auth.entity.Account;
import com.medtracker.auth.entity.UserSession;
import com.medtracker.auth.enums.AuditEventType;
import com.medtracker.auth.enums.AuthSurface;
import com.medtracker.auth.event.AuditEvent;
import com.medtracker.auth.event.AuthEventPublisher;
import com.medtracker.auth.exception.AccountLockedException;
import com.medtracker.auth.exception.DuplicateSubmissionException;
import com.medtracker.auth.exception.InvalidCredentialsException;
import com.medtracker.auth.exception.PasswordTooLongException;
import com.medtracker.auth.exception.RateLimitedException;
import com.medtracker.auth.exception.SessionRequiredException;
import com.medtracker.auth.exception.ValidationFailureException;
import com.medtracker.auth.security.CredentialHasher;
import com.medtracker.auth.security.identity.CallerIdentity;
import com.medtracker.auth.security.identity.CallerIdentityResolver;
import com.medtracker.auth.security.identity.SessionIdentityResolver;
import com.medtracker.auth.security.identity.SessionIdentityResolver.SessionResolution;
import com.medtracker.auth.security.token.TokenCodec;
import com.medtracker.auth.service.AccountLockoutService.LockoutOutcome;
import com.medtracker.auth.service.DuplicateSubmissionGuard.GuardPermit;
import com.medtracker.auth.util.CorrelationIdUtil;
import com.medtracker.auth.util.EmailMasker;
import com.medtracker.auth.util.EmailNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Authentication orchestrator for the login, register, logout, session-status
 * and demo flows.
 *
 * <p>Failures leave as {@link com.medtracker.auth.exception.AuthenticationException}
 * subtypes; anything else is an internal failure for the exception handler.
 * No method here is transactional: the slow hash must not run while row locks
 * are held, so each store mutation commits on its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationService {

    static final String REGISTRATION_FAILED = "REGISTRATION_FAILED";
    static final String DEMO_RATE_KEY = "demo:start";

    private final AccountService accountService;
    private final SessionService sessionService;
    private final AccountLockoutService accountLockoutService;
    private final RateLimitingService rateLimitingService;
    private final DuplicateSubmissionGuard duplicateSubmissionGuard;
    private final PasswordPolicyService passwordPolicyService;
    private final CredentialHasher credentialHasher;
    private final TokenCodec tokenCodec;
    private final SessionIdentityResolver sessionIdentityResolver;
    private final List<CallerIdentityResolver> identityResolvers;
    private final AuthEventPublisher eventPublisher;
    private final CorrelationIdUtil correlationIdUtil;
    private final EmailNormalizer emailNormalizer;
    private final AuthProperties authProperties;
    private final Clock clock;

    /**
     * Password login. Unknown account, wrong password and malformed email are
     * indistinguishable to the caller.
     */
    public AuthOutcome<AccountResponse> login(LoginRequest request) {
        // Keyed on the raw address so normalized variants share no budget advantage
        String rawEmail = request.getEmail() != null ? request.getEmail() : "";
        String rateKey = "login:" + rawEmail.toLowerCase(Locale.ROOT);
        if (!rateLimitingService.allow(rateKey)) {
            throw new RateLimitedException(rateLimitingService.retryAfterSeconds(rateKey));
        }

        String email;
        try {
            email = emailNormalizer.normalize(request.getEmail());
        } catch (IllegalArgumentException e) {
            log.info("Login rejected for malformed email: {}", EmailMasker.mask(request.getEmail()));
            audit(AuditEventType.LOGIN_FAILURE, attributes("reason", "malformed_email"));
            throw new InvalidCredentialsException();
        }

        try (GuardPermit permit = duplicateSubmissionGuard.acquire("login:" + email)) {
            if (!permit.isAcquired()) {
                log.info("Duplicate login submission for: {}", EmailMasker.mask(email));
                throw new DuplicateSubmissionException();
            }
            return authenticate(email, request.getPassword());
        }
    }

    private AuthOutcome<AccountResponse> authenticate(String email, String password) {
        log.debug("Authenticating account: {} with correlation ID: {}",
                EmailMasker.mask(email), correlationIdUtil.getCorrelationId());

        Optional<Account> found = accountService.findByEmail(email).filter(Account::isActive);
        if (found.isEmpty()) {
            log.info("Login failed for {}: unknown or inactive account", EmailMasker.mask(email));
            audit(AuditEventType.LOGIN_FAILURE, attributes("reason", "invalid_credentials"));
            throw new InvalidCredentialsException();
        }
        Account account = found.get();

        if (accountLockoutService.isLocked(account)) {
            Duration remaining = accountLockoutService.remainingLock(account);
            log.info("Login rejected for locked account: {} ({}s remaining)", account.getId(), remaining.getSeconds());
            audit(AuditEventType.LOGIN_FAILURE, attributes(
                    "account_id", account.getId(),
                    "attempt_count", account.getFailedAttempts(),
                    "locked_until", account.getLockUntil()));
            throw new AccountLockedException("Account is locked", account.getLockUntil(), remaining);
        }

        if (!credentialHasher.verify(password, account.getPasswordHash())) {
            handleFailedAttempt(account);
        }

        accountLockoutService.recordSuccess(account.getId());
        UserSession session = sessionService.create(
                account.getId(), authProperties.getSession().getTtl(), false);

        log.info("Login succeeded for account: {}", account.getId());
        audit(AuditEventType.LOGIN_SUCCESS, attributes(
                "account_id", account.getId(),
                "session_id", session.getId()));
        return AuthOutcome.withSession(AccountResponse.from(account), HttpStatus.OK, session);
    }

    private void handleFailedAttempt(Account account) {
        LockoutOutcome outcome = accountLockoutService.recordFailure(account.getId());
        Instant now = clock.instant();

        if (outcome.isLockTriggered()) {
            audit(AuditEventType.LOCKOUT_TRIGGER, attributes(
                    "account_id", account.getId(),
                    "attempt_count", outcome.getFailedAttempts(),
                    "locked_until", outcome.getLockUntil()));
            throw new AccountLockedException("Account is locked",
                    outcome.getLockUntil(), Duration.between(now, outcome.getLockUntil()));
        }
        if (outcome.getLockUntil() != null && outcome.getLockUntil().isAfter(now)) {
            // Locked by a concurrent attempt between our check and this failure
            throw new AccountLockedException("Account is locked",
                    outcome.getLockUntil(), Duration.between(now, outcome.getLockUntil()));
        }

        log.info("Login failed for account: {} (attempt #{})", account.getId(), outcome.getFailedAttempts());
        audit(AuditEventType.LOGIN_FAILURE, attributes(
                "account_id", account.getId(),
                "attempt_count", outcome.getFailedAttempts()));
        throw new InvalidCredentialsException();
    }

    /**
     * Create an account and sign it in.
     */
    public AuthOutcome<AccountResponse> register(RegisterRequest request) {
        String email;
        try {
            email = emailNormalizer.normalize(request.getEmail());
        } catch (IllegalArgumentException e) {
            log.warn("Registration rejected: {}", e.getMessage());
            audit(AuditEventType.REGISTER_FAILURE, attributes("reason", "invalid_email"));
            throw new ValidationFailureException(REGISTRATION_FAILED);
        }

        passwordPolicyService.requireValid(request.getPassword());

        try (GuardPermit permit = duplicateSubmissionGuard.acquire("register:" + email)) {
            if (!permit.isAcquired()) {
                log.info("Duplicate registration submission for: {}", EmailMasker.mask(email));
                throw new DuplicateSubmissionException();
            }

            log.info("Processing registration for email: {} with correlation ID: {}",
                    EmailMasker.mask(email), correlationIdUtil.getCorrelationId());

            Account account;
            try {
                account = accountService.create(email, request.getPassword(), deriveNames(email, request));
            } catch (PasswordTooLongException e) {
                throw new ValidationFailureException(PasswordPolicyService.PASSWORD_TOO_LONG);
            }

            UserSession session = sessionService.create(
                    account.getId(), authProperties.getSession().getTtl(), false);

            audit(AuditEventType.REGISTER_SUCCESS, attributes(
                    "account_id", account.getId(),
                    "session_id", session.getId()));
            return AuthOutcome.withSession(AccountResponse.from(account), HttpStatus.CREATED, session);
        }
    }

    /**
     * first name: explicit, display name, email local part, "User".
     * last name: explicit, display name when it differs from the first name, "User".
     */
    static AccountService.AccountNames deriveNames(String email, RegisterRequest request) {
        String localPart = email.substring(0, email.indexOf('@'));
        String firstName = firstNonBlank(request.getFirstName(), request.getDisplayName(), localPart, "User");

        String displayName = trimToNull(request.getDisplayName());
        String lastFallback = displayName != null && !displayName.equals(firstName) ? displayName : null;
        String lastName = firstNonBlank(request.getLastName(), lastFallback, "User");

        return AccountService.AccountNames.builder()
                .firstName(firstName)
                .lastName(lastName)
                .displayName(displayName != null ? displayName : firstName)
                .build();
    }

    /**
     * Always succeeds. Revokes the referenced session when it is still valid.
     */
    public AuthOutcome<LogoutResponse> logout(String sessionId) {
        try {
            sessionService.get(sessionId)
                    .filter(session -> session.isValidAt(clock.instant()))
                    .ifPresent(session -> {
                        sessionService.revoke(session.getId());
                        audit(AuditEventType.LOGOUT, attributes(
                                "account_id", session.getAccountId(),
                                "session_id", session.getId()));
                    });
        } catch (RuntimeException e) {
            // The cookie is cleared regardless, so the caller is signed out either way
            log.warn("Session revocation failed during logout", e);
        }
        return AuthOutcome.clearingCookie(new LogoutResponse(true), HttpStatus.OK);
    }

    public AuthOutcome<SessionStatusResponse> sessionStatus(String sessionId) {
        if (isBlank(sessionId)) {
            throw new SessionRequiredException("NO_SESSION");
        }

        SessionResolution resolution = sessionIdentityResolver.inspect(sessionId);
        if (!resolution.getLookup().isActive()) {
            log.debug("Session status: {}", resolution.getLookup().getStatus());
            return AuthOutcome.clearingCookie(SessionStatusResponse.unauthenticated(), HttpStatus.OK);
        }
        if (resolution.isAccountMissing()) {
            log.warn("Session {} references a missing account", resolution.getLookup().getSession().getId());
            throw new SessionRequiredException("NO_USER", true);
        }

        UserSession session = resolution.getLookup().getSession();
        SessionStatusResponse body = SessionStatusResponse.builder()
                .authenticated(true)
                .user(AccountResponse.identityOf(resolution.getAccount()))
                .session(SessionResponse.from(session))
                .build();
        return AuthOutcome.of(body, HttpStatus.OK);
    }

    public AuthOutcome<DemoResponse> startDemo() {
        if (!rateLimitingService.allow(DEMO_RATE_KEY)) {
            throw new RateLimitedException(rateLimitingService.retryAfterSeconds(DEMO_RATE_KEY));
        }

        Account account = accountService.ensureDemoAccount();
        UserSession session = sessionService.create(
                account.getId(), authProperties.getDemo().getSessionTtl(), true);

        log.info("Demo session started: {}", session.getId());
        audit(AuditEventType.DEMO_START, attributes(
                "account_id", account.getId(),
                "session_id", session.getId()));

        DemoResponse body = DemoResponse.builder()
                .user(AccountResponse.identityOf(account))
                .session(SessionResponse.from(session))
                .build();
        return AuthOutcome.withSession(body, HttpStatus.OK, session);
    }

    /**
     * Exchange a valid session for a bearer token.
     */
    public TokenResponse issueToken(String sessionId) {
        CallerIdentity identity = sessionIdentityResolver.resolve(sessionId)
                .orElseThrow(() -> new SessionRequiredException("NO_SESSION"));

        return TokenResponse.builder()
                .accessToken(tokenCodec.issueForAccount(identity.getAccount()))
                .expiresIn(tokenCodec.accessTokenTtlSeconds())
                .build();
    }

    /**
     * Resolve the caller through the bearer token first, then the session cookie.
     */
    public CallerResponse currentCaller(String bearerToken, String sessionId) {
        Map<AuthSurface, String> credentials = new LinkedHashMap<>();
        credentials.put(AuthSurface.TOKEN, bearerToken);
        credentials.put(AuthSurface.SESSION, sessionId);

        for (Map.Entry<AuthSurface, String> credential : credentials.entrySet()) {
            if (isBlank(credential.getValue())) {
                continue;
            }
            Optional<CallerIdentity> identity = identityResolvers.stream()
                    .filter(resolver -> resolver.surface() == credential.getKey())
                    .findFirst()
                    .flatMap(resolver -> resolver.resolve(credential.getValue()));
            if (identity.isPresent()) {
                return CallerResponse.builder()
                        .user(AccountResponse.from(identity.get().getAccount()))
                        .surface(identity.get().getSurface())
                        .build();
            }
        }
        throw new SessionRequiredException("NO_SESSION");
    }

    private void audit(AuditEventType type, Map<String, Object> attributes) {
        try {
            eventPublisher.publish(AuditEvent.of(
                    type, correlationIdUtil.getCorrelationId(), clock.instant(), attributes));
        } catch (Exception e) {
            log.error("Failed to publish audit event {}", type.getCode(), e);
        }
    }

    private static Map<String, Object> attributes(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            String trimmed = trimToNull(value);
            if (trimmed != null) {
                return trimmed;
            }
        }
        return null;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
