package com.ybds.auth;

/**
 * Reads the raw token from a custom header such as {@code X-Auth-Token}.
 */
public final class HeaderTokenAuthenticator extends TokenAuthenticator {
    private final String headerName;

    public HeaderTokenAuthenticator(String headerName, TokenValidator validator) {
        super(validator);
        if (headerName == null || headerName.isBlank()) {
            throw new IllegalArgumentException("headerName is required");
        }
        this.headerName = headerName;
    }

    @Override
    protected String extractToken(RequestContext request) {
        return request.header(headerName);
    }

    @Override
    protected String source() {
        return "header:" + headerName;
    }
}
