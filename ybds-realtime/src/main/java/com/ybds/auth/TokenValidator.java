package com.ybds.auth;

/**
 * Verifies a raw token and returns the identity it carries.
 */
@FunctionalInterface
public interface TokenValidator {

    Identity validate(String token) throws AuthenticationException;
}
