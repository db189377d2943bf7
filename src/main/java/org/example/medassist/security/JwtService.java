package org.example.medassist.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SecureDigestAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.example.medassist.config.JwtProperties;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and checks the stateless bearer tokens handed out at login. A token carries the
 * account email as its subject and an absolute expiry; nothing is stored server side.
 */
@Slf4j
@Service
public class JwtService {

    private final SecretKey key;
    private final MacAlgorithm algorithm;
    private final Duration ttl;
    private final Clock clock;

    public JwtService(JwtProperties properties, Clock clock) {
        this.algorithm = resolveAlgorithm(properties.algorithm());
        byte[] secret = properties.secret().getBytes(StandardCharsets.UTF_8);
        if (secret.length * 8 < algorithm.getKeyBitLength()) {
            throw new IllegalStateException("app.jwt.secret must be at least "
                    + algorithm.getKeyBitLength() / 8 + " bytes for " + algorithm.getId());
        }
        this.key = Keys.hmacShaKeyFor(secret);
        this.ttl = properties.accessTokenTtl();
        this.clock = clock;
    }

    private static MacAlgorithm resolveAlgorithm(String name) {
        SecureDigestAlgorithm<?, ?> candidate = Jwts.SIG.get().get(name);
        if (candidate instanceof MacAlgorithm mac) {
            return mac;
        }
        throw new IllegalStateException("Unsupported app.jwt.algorithm: " + name
                + " (expected HS256, HS384 or HS512)");
    }

    public Duration getTtl() {
        return ttl;
    }

    public String issue(String subject) {
        return issue(subject, ttl);
    }

    public String issue(String subject, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, algorithm)
                .compact();
    }

    /**
     * Checks signature, algorithm and expiry.
     *
     * @return the subject claim, or empty if the token is not acceptable for any reason
     */
    public Optional<String> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Jws<Claims> jws = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);

            if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
                log.debug("Rejected token signed with {}", jws.getHeader().getAlgorithm());
                return Optional.empty();
            }
            String subject = jws.getPayload().getSubject();
            if (subject == null || subject.isBlank()) {
                log.debug("Rejected token without subject");
                return Optional.empty();
            }
            return Optional.of(subject);
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected token: {}", ex.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}
