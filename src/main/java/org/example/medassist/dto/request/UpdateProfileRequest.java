package org.example.medassist.dto.request;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Partial profile update. Null fields are left alone, and so are lists with no non-blank item.
 */
@Getter
@Setter
public class UpdateProfileRequest {
    private String fullName;
    private String dateOfBirth;
    private String phone;
    private String address;
    private String emergencyContact;
    private String medicalHistory;
    private List<String> allergies;
    private List<String> currentMedications;
    private String bloodType;
    private String height;
    private String weight;
}
