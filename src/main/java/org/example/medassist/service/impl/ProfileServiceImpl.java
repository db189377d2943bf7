package org.example.medassist.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.medassist.dto.request.UpdateProfileRequest;
import org.example.medassist.dto.response.ProfileResponse;
import org.example.medassist.dto.response.ProfileUpdateResponse;
import org.example.medassist.dto.response.UserProfileResponse;
import org.example.medassist.model.DelimitedListConverter;
import org.example.medassist.model.User;
import org.example.medassist.repository.UserRepository;
import org.example.medassist.service.ProfileService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileServiceImpl implements ProfileService {

    private static final DelimitedListConverter LIST_CONVERTER = new DelimitedListConverter();

    private final UserRepository userRepository;
    private final Clock clock;

    @Override
    public UserProfileResponse getProfile(User user) {
        return UserProfileResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .dateOfBirth(user.getDateOfBirth())
                .phone(user.getPhone())
                .address(user.getAddress())
                .emergencyContact(user.getEmergencyContact())
                .medicalHistory(user.getMedicalHistory())
                .allergies(LIST_CONVERTER.convertToDatabaseColumn(user.getAllergies()))
                .currentMedications(LIST_CONVERTER.convertToDatabaseColumn(user.getCurrentMedications()))
                .bloodType(user.getBloodType())
                .height(user.getHeight())
                .weight(user.getWeight())
                .age(user.getAge())
                .gender(user.getGender())
                .verified(user.isVerified())
                .createdAt(user.getCreatedAt())
                .lastLogin(user.getLastLogin())
                .build();
    }

    /**
     * Last write wins: two concurrent updates of the same user are not merged.
     */
    @Override
    @Transactional
    public ProfileUpdateResponse updateProfile(User user, UpdateProfileRequest request) {
        if (request.getFullName() != null) {
            user.setFullName(request.getFullName());
        }
        if (request.getDateOfBirth() != null) {
            user.setDateOfBirth(request.getDateOfBirth());
        }
        if (request.getPhone() != null) {
            user.setPhone(request.getPhone());
        }
        if (request.getAddress() != null) {
            user.setAddress(request.getAddress());
        }
        if (request.getEmergencyContact() != null) {
            user.setEmergencyContact(request.getEmergencyContact());
        }
        if (request.getMedicalHistory() != null) {
            user.setMedicalHistory(request.getMedicalHistory());
        }
        if (request.getBloodType() != null) {
            user.setBloodType(request.getBloodType());
        }
        if (request.getHeight() != null) {
            user.setHeight(request.getHeight());
        }
        if (request.getWeight() != null) {
            user.setWeight(request.getWeight());
        }

        // an empty list cannot clear the stored one
        List<String> allergies = nonBlankItems(request.getAllergies());
        if (!allergies.isEmpty()) {
            user.setAllergies(allergies);
        }
        List<String> medications = nonBlankItems(request.getCurrentMedications());
        if (!medications.isEmpty()) {
            user.setCurrentMedications(medications);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime previous = user.getUpdatedAt();
        user.setUpdatedAt(previous != null && previous.isAfter(now) ? previous : now);

        User saved = userRepository.save(user);
        log.info("Updated profile of user {}", saved.getId());

        return new ProfileUpdateResponse("Profile updated successfully", toProfile(saved));
    }

    private static List<String> nonBlankItems(List<String> items) {
        if (items == null) {
            return new ArrayList<>();
        }
        return items.stream()
                .filter(item -> item != null && !item.isBlank())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static ProfileResponse toProfile(User user) {
        return ProfileResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .dateOfBirth(user.getDateOfBirth())
                .phone(user.getPhone())
                .address(user.getAddress())
                .emergencyContact(user.getEmergencyContact())
                .medicalHistory(user.getMedicalHistory())
                .allergies(LIST_CONVERTER.convertToDatabaseColumn(user.getAllergies()))
                .currentMedications(LIST_CONVERTER.convertToDatabaseColumn(user.getCurrentMedications()))
                .bloodType(user.getBloodType())
                .height(user.getHeight())
                .weight(user.getWeight())
                .build();
    }
}
