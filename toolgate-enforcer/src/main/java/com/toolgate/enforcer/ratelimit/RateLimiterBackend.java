package com.toolgate.enforcer.ratelimit;

/**
 * Token-bucket store. Implementations must be thread-safe and must serialize
 * updates per key.
 */
public interface RateLimiterBackend {

    /**
     * Try to take one token from the bucket identified by {@code key}.
     *
     * @param limitPerMinute refill rate
     * @param burst          bucket capacity; {@code <= 0} means {@code limitPerMinute}
     */
    RateLimitResult consume(String key, int limitPerMinute, int burst);

    /**
     * Bucket capacity for the given settings, never below one token.
     */
    static int capacity(int limitPerMinute, int burst) {
        return Math.max(1, burst > 0 ? burst : limitPerMinute);
    }
}
