package org.example.medassist.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Editable profile fields as stored after an update. List fields are rendered in their stored
 * comma-separated form, null when empty.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {
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
}
