package org.example.medassist.service;

import org.example.medassist.dto.request.UpdateProfileRequest;
import org.example.medassist.dto.response.ProfileUpdateResponse;
import org.example.medassist.dto.response.UserProfileResponse;
import org.example.medassist.model.User;

public interface ProfileService {
    UserProfileResponse getProfile(User user);
    ProfileUpdateResponse updateProfile(User user, UpdateProfileRequest request);
}
