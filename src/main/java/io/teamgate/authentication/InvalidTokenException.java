package io.teamgate.authentication;

/**
 * Raised when GitHub rejects the access token a request was made with
 */
public class InvalidTokenException extends GateAuthenticationException {
    public InvalidTokenException(String message) {
        super(message);
    }
}
