package org.example.medassist.exception;

/**
 * A protected call presented a missing, invalid or expired token, or a token naming no account.
 */
public class UnauthorizedException extends RuntimeException {

    public static final String NOT_AUTHENTICATED = "Not authenticated";

    public UnauthorizedException() {
        super("Could not validate credentials");
    }

    public UnauthorizedException(String message) {
        super(message);
    }
}
