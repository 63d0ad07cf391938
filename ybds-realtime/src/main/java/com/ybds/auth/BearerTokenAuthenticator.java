package com.ybds.auth;

/**
 * Reads {@code Authorization: Bearer <token>}.
 */
public final class BearerTokenAuthenticator extends TokenAuthenticator {
    private static final String PREFIX = "Bearer ";

    public BearerTokenAuthenticator(TokenValidator validator) {
        super(validator);
    }

    @Override
    protected String extractToken(RequestContext request) {
        String header = request.header("Authorization");
        if (header == null || header.length() <= PREFIX.length()
                || !header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return null;
        }
        return header.substring(PREFIX.length());
    }

    @Override
    protected String source() {
        return "bearer";
    }
}
