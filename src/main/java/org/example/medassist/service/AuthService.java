package org.example.medassist.service;

import org.example.medassist.dto.request.RegisterRequest;
import org.example.medassist.dto.response.RegisterResponse;
import org.example.medassist.dto.response.TokenResponse;
import org.example.medassist.model.User;

public interface AuthService {
    RegisterResponse register(RegisterRequest request);
    User authenticate(String email, String password);
    TokenResponse login(String email, String password);
}
