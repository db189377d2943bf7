package org.example.medassist.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileResponse {
    private Long id;
    private String email;
    private String fullName;
    private String dateOfBirth;
    private String phone;
    private String address;
    private String emergencyContact;
    private String medicalHistory;
    private String allergies;
    private String currentMedications;
    private String bloodType;
    private String height;
    private String weight;
    private Integer age;
    private String gender;
    @JsonProperty("is_verified")
    private Boolean verified;
    private LocalDateTime createdAt;
    private LocalDateTime lastLogin;
}
