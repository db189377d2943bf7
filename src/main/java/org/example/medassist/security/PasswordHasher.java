package org.example.medassist.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way hashing of account passwords. The encoded hash carries its own salt and cost factor,
 * so a stored value can be verified without any other input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    /**
     * @return true only if {@code plaintext} matches {@code hash}; false for a mismatch, a null
     *     argument or a stored value that is not a valid hash.
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException ex) {
            log.debug("Stored password hash could not be parsed: {}", ex.getMessage());
            return false;
        }
    }
}
