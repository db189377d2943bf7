package org.example.medassist.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.medassist.dto.request.RegisterRequest;
import org.example.medassist.dto.response.RegisterResponse;
import org.example.medassist.dto.response.TokenResponse;
import org.example.medassist.dto.response.UserSummary;
import org.example.medassist.exception.DuplicateEmailException;
import org.example.medassist.exception.InvalidCredentialsException;
import org.example.medassist.model.User;
import org.example.medassist.repository.UserRepository;
import org.example.medassist.security.JwtService;
import org.example.medassist.security.PasswordHasher;
import org.example.medassist.service.AuthService;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private static final String TOKEN_TYPE = "bearer";

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final JwtService jwtService;
    private final Clock clock;

    @Override
    @Transactional
    public RegisterResponse register(RegisterRequest request) {
        String email = request.getEmail();
        if (userRepository.findByEmail(email).isPresent()) {
            throw new DuplicateEmailException();
        }

        User user = new User(email, passwordHasher.hash(request.getPassword()));
        user.setFullName(request.getFullName());
        user.setAge(request.getAge());
        user.setGender(request.getGender());
        user.setVerified(false);
        user.setCreatedAt(LocalDateTime.now(clock));

        User created;
        try {
            created = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent registration won the insert
            throw new DuplicateEmailException(ex);
        }

        log.info("Registered user {}", created.getId());
        return new RegisterResponse("User registered successfully", created.getId(), created.getEmail());
    }

    @Override
    @Transactional(readOnly = true)
    public User authenticate(String email, String password) {
        User user = userRepository.findByEmail(email).orElse(null);
        if (user == null || !passwordHasher.verify(password, user.getHashedPassword())) {
            log.warn("Rejected login attempt");
            throw new InvalidCredentialsException();
        }
        return user;
    }

    @Override
    @Transactional
    public TokenResponse login(String email, String password) {
        User user = authenticate(email, password);

        user.setLastLogin(LocalDateTime.now(clock));
        userRepository.save(user);

        String token = jwtService.issue(user.getEmail());
        log.info("User {} logged in", user.getId());

        return new TokenResponse(
                token,
                TOKEN_TYPE,
                jwtService.getTtl().toSeconds(),
                new UserSummary(user.getId(), user.getEmail(), user.getFullName())
        );
    }
}
