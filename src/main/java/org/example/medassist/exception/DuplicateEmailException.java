package org.example.medassist.exception;

public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException() {
        super("Email already registered");
    }

    public DuplicateEmailException(Throwable cause) {
        super("Email already registered", cause);
    }
}
