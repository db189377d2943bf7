package org.example.medassist.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(name = "uk_users_email", columnNames = "email"))
@Getter
@Setter
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String email;

    @Column(name = "hashed_password", nullable = false)
    private String hashedPassword;

    @Column
    private String fullName;

    @Column
    private String dateOfBirth;

    @Column
    private String phone;

    @Column
    private String address;

    @Column
    private String emergencyContact;

    @Column(columnDefinition = "TEXT")
    private String medicalHistory;

    @Convert(converter = DelimitedListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> allergies = new ArrayList<>();

    @Convert(converter = DelimitedListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> currentMedications = new ArrayList<>();

    @Column
    private String bloodType;

    @Column
    private String height;

    @Column
    private String weight;

    @Column
    private Integer age;

    @Column
    private String gender;

    @Column(name = "is_verified", nullable = false)
    private boolean verified = false;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column
    private LocalDateTime lastLogin;

    @Column
    private LocalDateTime updatedAt;

    public User() {}

    public User(String email, String hashedPassword) {
        this.email = email;
        this.hashedPassword = hashedPassword;
    }
}
