package io.teamgate.authentication;

/**
 * Raised when input from a caller (a webhook payload, an Authorization header) cannot be
 * decoded
 */
public class MalformedInputException extends GateAuthenticationException {
    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
    public MalformedInputException(String message) {
        super(message);
    }
}
