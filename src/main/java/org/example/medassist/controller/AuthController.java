package org.example.medassist.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.medassist.dto.request.RegisterRequest;
import org.example.medassist.dto.request.TokenRequest;
import org.example.medassist.dto.request.UpdateProfileRequest;
import org.example.medassist.dto.response.ProfileUpdateResponse;
import org.example.medassist.dto.response.RegisterResponse;
import org.example.medassist.dto.response.TokenResponse;
import org.example.medassist.dto.response.UserProfileResponse;
import org.example.medassist.model.User;
import org.example.medassist.security.CurrentUserResolver;
import org.example.medassist.service.AuthService;
import org.example.medassist.service.ProfileService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final ProfileService profileService;
    private final CurrentUserResolver currentUserResolver;

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(
            @RequestParam String email,
            @RequestParam String password,
            @RequestParam(name = "full_name", required = false) String fullName,
            @RequestParam(required = false) Integer age,
            @RequestParam(required = false) String gender) {
        RegisterRequest request = new RegisterRequest(email, password, fullName, age, gender);
        return ResponseEntity.ok(authService.register(request));
    }

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<TokenResponse> token(@Valid @ModelAttribute TokenRequest request) {
        return ResponseEntity.ok(authService.login(request.getUsername(), request.getPassword()));
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        User user = currentUserResolver.resolveAuthorizationHeader(authorization);
        return ResponseEntity.ok(profileService.getProfile(user));
    }

    @PutMapping("/profile")
    public ResponseEntity<ProfileUpdateResponse> updateProfile(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody UpdateProfileRequest request) {
        User user = currentUserResolver.resolveAuthorizationHeader(authorization);
        return ResponseEntity.ok(profileService.updateProfile(user, request));
    }
}
