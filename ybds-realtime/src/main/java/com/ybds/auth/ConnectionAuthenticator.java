package com.ybds.auth;

/**
 * Resolves an upgrade request into an identity before any hub state exists.
 *
 * Implementations must either return a complete {@link Identity} or throw;
 * there is no partially authenticated outcome.
 */
@FunctionalInterface
public interface ConnectionAuthenticator {

    Identity authenticate(RequestContext request) throws AuthenticationException;
}
