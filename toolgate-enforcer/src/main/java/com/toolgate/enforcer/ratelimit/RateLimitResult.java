package com.toolgate.enforcer.ratelimit;

/**
 * Outcome of one token request.
 *
 * @param allowed          whether a token was consumed
 * @param remaining        whole tokens left in the bucket afterwards
 * @param retryAfterMillis time until one token is available, 0 when allowed
 */
public record RateLimitResult(boolean allowed, int remaining, long retryAfterMillis) {

    public static RateLimitResult allowed(int remaining) {
        return new RateLimitResult(true, remaining, 0);
    }

    public static RateLimitResult limited(int remaining, long retryAfterMillis) {
        return new RateLimitResult(false, remaining, retryAfterMillis);
    }
}
