package org.example.medassist.dto.request;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RegisterRequest {

    private String email;
    private String password;
    private String fullName;
    private Integer age;
    private String gender;

    public RegisterRequest() {
    }

    public RegisterRequest(String email, String password, String fullName, Integer age, String gender) {
        this.email = email;
        this.password = password;
        this.fullName = fullName;
        this.age = age;
        this.gender = gender;
    }
}
