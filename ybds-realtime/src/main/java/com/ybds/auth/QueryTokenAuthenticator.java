package com.ybds.auth;

/**
 * Reads the token from a query parameter, {@code ?token=<jwt>} by default.
 * Browsers cannot set headers on a WebSocket handshake, so this is the default strategy.
 */
public final class QueryTokenAuthenticator extends TokenAuthenticator {
    private final String parameter;

    public QueryTokenAuthenticator(TokenValidator validator) {
        this("token", validator);
    }

    public QueryTokenAuthenticator(String parameter, TokenValidator validator) {
        super(validator);
        this.parameter = parameter;
    }

    @Override
    protected String extractToken(RequestContext request) {
        return request.queryParam(parameter);
    }

    @Override
    protected String source() {
        return "query:" + parameter;
    }
}
