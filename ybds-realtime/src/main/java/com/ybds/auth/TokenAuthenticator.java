package com.ybds.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for strategies that pull a token out of the request and hand it to a {@link TokenValidator}.
 */
public abstract class TokenAuthenticator implements ConnectionAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(TokenAuthenticator.class);

    private final TokenValidator validator;

    protected TokenAuthenticator(TokenValidator validator) {
        if (validator == null) {
            throw new IllegalArgumentException("validator is required");
        }
        this.validator = validator;
    }

    /**
     * Extract the raw token, or return null when the request carries none.
     */
    protected abstract String extractToken(RequestContext request);

    /**
     * Short label used in log lines.
     */
    protected abstract String source();

    @Override
    public final Identity authenticate(RequestContext request) throws AuthenticationException {
        String token = extractToken(request);
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("No token provided (" + source() + ")");
        }

        Identity identity = validator.validate(token.trim());
        log.debug("Token from {} accepted for user {} (roles={})", source(), identity.userId(), identity.roles());
        return identity;
    }
}
