package com.ybds.auth;

import java.util.Set;

/**
 * Accepts every request as the shared anonymous guest. Development use only.
 */
public final class AnonymousAuthenticator implements ConnectionAuthenticator {
    public static final Identity ANONYMOUS = new Identity("anonymous", Set.of("guest"));

    @Override
    public Identity authenticate(RequestContext request) {
        return ANONYMOUS;
    }
}
