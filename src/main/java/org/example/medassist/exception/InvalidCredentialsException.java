package org.example.medassist.exception;

/**
 * Login failure. Unknown email and wrong password both end here with the same message.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Incorrect email or password");
    }
}
