package com.ybds.auth;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Verified connection identity produced by a {@link ConnectionAuthenticator}.
 */
public record Identity(String userId, Set<String> roles) {

    public Identity {
        Objects.requireNonNull(userId, "userId");
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public static Identity of(String userId, Collection<String> roles) {
        return new Identity(userId, roles == null ? Set.of() : Set.copyOf(roles));
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasAnyRole(String... candidates) {
        for (String role : candidates) {
            if (roles.contains(role)) {
                return true;
            }
        }
        return false;
    }
}
