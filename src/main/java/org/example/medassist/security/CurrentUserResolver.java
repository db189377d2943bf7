package org.example.medassist.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.medassist.exception.UnauthorizedException;
import org.example.medassist.model.User;
import org.example.medassist.repository.UserRepository;
import org.springframework.stereotype.Component;

/**
 * Turns a bearer token into the account it names. Called once by every protected operation;
 * each call does one token check and one lookup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CurrentUserResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final UserRepository userRepository;

    public User resolveAuthorizationHeader(String authorizationHeader) {
        if (authorizationHeader == null
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            // no bearer credentials presented at all
            throw new UnauthorizedException(UnauthorizedException.NOT_AUTHENTICATED);
        }
        return resolve(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
    }

    public User resolve(String token) {
        String email = jwtService.verify(token).orElseThrow(UnauthorizedException::new);
        return userRepository.findByEmail(email).orElseThrow(() -> {
            // token outlived its account
            log.debug("Valid token names no existing user");
            return new UnauthorizedException();
        });
    }
}
