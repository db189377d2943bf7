package org.example.medassist.security;

import org.example.medassist.config.JwtProperties;
import org.example.medassist.exception.UnauthorizedException;
import org.example.medassist.model.User;
import org.example.medassist.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CurrentUserResolverTest {

    @Mock private JwtService jwtService;
    @Mock private UserRepository userRepository;

    @InjectMocks private CurrentUserResolver resolver;

    private User alice;

    @BeforeEach
    void setUp() {
        alice = new User("alice@example.com", "$2a$04$hash");
        alice.setId(1L);
    }

    @Test
    void resolve_shouldReturnUserNamedByToken() {
        when(jwtService.verify("good-token")).thenReturn(Optional.of("alice@example.com"));
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        assertSame(alice, resolver.resolve("good-token"));
        verify(jwtService, times(1)).verify("good-token");
        verify(userRepository, times(1)).findByEmail("alice@example.com");
    }

    @Test
    void resolve_shouldThrowUnauthorized_whenTokenInvalid() {
        when(jwtService.verify("bad-token")).thenReturn(Optional.empty());

        assertThrows(UnauthorizedException.class, () -> resolver.resolve("bad-token"));
        verify(userRepository, never()).findByEmail(any());
    }

    @Test
    void resolve_shouldThrowUnauthorized_whenUserNoLongerExists() {
        when(jwtService.verify("orphan-token")).thenReturn(Optional.of("gone@example.com"));
        when(userRepository.findByEmail("gone@example.com")).thenReturn(Optional.empty());

        UnauthorizedException ex = assertThrows(UnauthorizedException.class, () -> resolver.resolve("orphan-token"));
        assertEquals("Could not validate credentials", ex.getMessage());
    }

    @Test
    void resolveAuthorizationHeader_shouldStripBearerScheme() {
        when(jwtService.verify("good-token")).thenReturn(Optional.of("alice@example.com"));
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        assertSame(alice, resolver.resolveAuthorizationHeader("Bearer good-token"));
        assertSame(alice, resolver.resolveAuthorizationHeader("bearer good-token"));
    }

    @Test
    void resolveAuthorizationHeader_shouldReportNotAuthenticated_whenHeaderMissing() {
        UnauthorizedException ex = assertThrows(UnauthorizedException.class,
                () -> resolver.resolveAuthorizationHeader(null));

        assertEquals("Not authenticated", ex.getMessage());
    }

    @Test
    void resolve_shouldRejectExpiredTokenIssuedForExistingUser() {
        JwtProperties properties = new JwtProperties("test-secret-key-that-is-at-least-32-bytes-long", "HS256", 30);
        Instant issuedAt = Instant.parse("2026-01-01T10:00:00Z");
        String token = new JwtService(properties, Clock.fixed(issuedAt, ZoneOffset.UTC)).issue("alice@example.com");

        JwtService later = new JwtService(properties,
                Clock.fixed(issuedAt.plus(Duration.ofMinutes(31)), ZoneOffset.UTC));
        CurrentUserResolver expiredResolver = new CurrentUserResolver(later, userRepository);

        UnauthorizedException ex = assertThrows(UnauthorizedException.class, () -> expiredResolver.resolve(token));
        assertEquals("Could not validate credentials", ex.getMessage());
        verify(userRepository, never()).findByEmail(any());
    }

    @Test
    void resolve_shouldAcceptUnexpiredTokenIssuedForExistingUser() {
        JwtProperties properties = new JwtProperties("test-secret-key-that-is-at-least-32-bytes-long", "HS256", 30);
        Instant issuedAt = Instant.parse("2026-01-01T10:00:00Z");
        String token = new JwtService(properties, Clock.fixed(issuedAt, ZoneOffset.UTC)).issue("alice@example.com");
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        JwtService later = new JwtService(properties,
                Clock.fixed(issuedAt.plus(Duration.ofMinutes(29)), ZoneOffset.UTC));

        assertSame(alice, new CurrentUserResolver(later, userRepository).resolve(token));
    }

    @Test
    void resolveAuthorizationHeader_shouldRejectMissingOrForeignScheme() {
        assertThrows(UnauthorizedException.class, () -> resolver.resolveAuthorizationHeader(null));
        assertThrows(UnauthorizedException.class, () -> resolver.resolveAuthorizationHeader(""));
        assertThrows(UnauthorizedException.class, () -> resolver.resolveAuthorizationHeader("Basic YWxpY2U6cHc="));
        verifyNoInteractions(jwtService, userRepository);
    }

    @Test
    void resolveAuthorizationHeader_shouldRejectEmptyBearerToken() {
        when(jwtService.verify("")).thenReturn(Optional.empty());

        assertThrows(UnauthorizedException.class, () -> resolver.resolveAuthorizationHeader("Bearer "));
    }
}
