package com.toolgate.enforcer.identity;

import java.util.Set;

/**
 * An authenticated caller: who they are and which roles they hold.
 */
public record Identity(String actor, Set<String> roles) {

    public static final Identity ANONYMOUS = new Identity(null, Set.of());

    public Identity {
        roles = roles != null ? Set.copyOf(roles) : Set.of();
    }

    public static Identity of(String actor, String... roles) {
        return new Identity(actor, Set.of(roles));
    }
}
