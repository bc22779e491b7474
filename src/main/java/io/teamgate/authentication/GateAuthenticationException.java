package io.teamgate.authentication;

/**
 * General exception used to represent issues with authentication processing
 */
public class GateAuthenticationException extends Exception {
    public GateAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
    public GateAuthenticationException(String message) {
        super(message);
    }
}
