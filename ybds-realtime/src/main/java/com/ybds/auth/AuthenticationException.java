package com.ybds.auth;

/**
 * Thrown when an upgrade request cannot be turned into a verified {@link Identity}.
 */
public class AuthenticationException extends Exception {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
