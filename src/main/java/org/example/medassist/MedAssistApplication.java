package org.example.medassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/**
 * Accounts live in the users table and are checked by the auth service, so Boot's in-memory
 * default user is switched off.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class MedAssistApplication {
    public static void main(String[] args) {
        SpringApplication.run(MedAssistApplication.class, args);
    }
}
