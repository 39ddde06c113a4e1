package com.medtracker.auth.security.token;

import com.medtracker.auth.config.AuthProperties;
import com.medtracker.auth.entity.Account;
import com.medtracker.auth.exception.InvalidTokenException;
import com.medtracker.auth.exception.TokenExpiredException;
import com.medtracker.auth.exception.TokenMalformedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * HS256 JWT issue/verify bound to the service issuer and audience.
 * Expiry is decided here against the application clock, not by the JWT library.
 */
@Slf4j
@Component
public class TokenCodec {

    static final Duration MAX_CLOCK_SKEW = Duration.ofMinutes(5);
    private static final int MIN_SECRET_BYTES = 32;
    private static final Set<String> REGISTERED_CLAIMS = Set.of(
            Claims.ISSUER, Claims.AUDIENCE, Claims.ISSUED_AT, Claims.EXPIRATION,
            Claims.ID, Claims.SUBJECT, Claims.NOT_BEFORE);

    private final AuthProperties.Token config;
    private final Clock clock;
    private final SecretKey signingKey;

    public TokenCodec(AuthProperties authProperties, Clock clock) {
        this.config = authProperties.getToken();
        this.clock = clock;
        this.signingKey = signingKey(config.getSecret());
    }

    /**
     * Issue a signed token. A non-positive {@code ttl} is clamped so that
     * {@code exp = iat + 1}.
     */
    public String issue(Map<String, Object> claims, Duration ttl) {
        long iat = clock.instant().getEpochSecond();
        long exp = iat + ttl.getSeconds();
        if (exp <= iat) {
            exp = iat + 1;
        }
        return build(claims, iat, exp);
    }

    /**
     * Issue a token whose expiry lies {@code age} in the past.
     */
    public String issueExpired(Map<String, Object> claims, Duration age) {
        long exp = clock.instant().getEpochSecond() - Math.max(1, age.getSeconds());
        return build(claims, exp - 1, exp);
    }

    public String issueForAccount(Account account) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(Claims.SUBJECT, account.getId().toString());
        claims.put("email", account.getEmail());
        claims.put("type", "access");
        return issue(claims, config.getAccessTokenTtl());
    }

    public long accessTokenTtlSeconds() {
        return config.getAccessTokenTtl().getSeconds();
    }

    public DecodedToken decode(String token) {
        if (token == null || token.split("\\.", -1).length != 3) {
            throw new TokenMalformedException("Token must have exactly three segments");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            // Signature was verified before the library's expiry check
            claims = ex.getClaims();
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected token: {}", ex.getMessage());
            throw new InvalidTokenException("Invalid token", ex);
        }

        if (!config.getIssuer().equals(claims.getIssuer())) {
            throw new InvalidTokenException("Unexpected issuer");
        }
        Set<String> audience = claims.getAudience();
        if (audience == null || !audience.contains(config.getAudience())) {
            throw new InvalidTokenException("Unexpected audience");
        }
        Date issuedAt = claims.getIssuedAt();
        Date expiration = claims.getExpiration();
        if (issuedAt == null || expiration == null) {
            throw new InvalidTokenException("Missing iat or exp");
        }

        Instant exp = expiration.toInstant();
        if (!clock.instant().isBefore(exp.plus(clockSkew()))) {
            throw new TokenExpiredException(exp);
        }

        Map<String, Object> custom = new LinkedHashMap<>(claims);
        REGISTERED_CLAIMS.forEach(custom::remove);

        return DecodedToken.builder()
                .subject(claims.getSubject())
                .tokenId(claims.getId())
                .issuedAt(issuedAt.toInstant())
                .expiresAt(exp)
                .claims(custom)
                .build();
    }

    Duration clockSkew() {
        Duration skew = config.getClockSkew();
        if (skew == null || skew.isNegative()) {
            return Duration.ZERO;
        }
        return skew.compareTo(MAX_CLOCK_SKEW) > 0 ? MAX_CLOCK_SKEW : skew;
    }

    private String build(Map<String, Object> claims, long iat, long exp) {
        return Jwts.builder()
                .claims(claims)
                .issuer(config.getIssuer())
                .audience().add(config.getAudience()).and()
                .issuedAt(Date.from(Instant.ofEpochSecond(iat)))
                .expiration(Date.from(Instant.ofEpochSecond(exp)))
                .id(UUID.randomUUID().toString())
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    private static SecretKey signingKey(String secret) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("auth.token.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
