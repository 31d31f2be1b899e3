package com.toolgate.enforcer.identity;

/**
 * Maps caller credentials to an {@link Identity}. Authentication itself
 * happens outside toolgate.
 *
 * @param <C> credential type, e.g. a token string or a request object
 */
@FunctionalInterface
public interface IdentityResolver<C> {

    Identity resolve(C credentials);

    static <C> IdentityResolver<C> anonymous() {
        return credentials -> Identity.ANONYMOUS;
    }
}
