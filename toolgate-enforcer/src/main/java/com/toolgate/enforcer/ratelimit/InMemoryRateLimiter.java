package com.toolgate.enforcer.ratelimit;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process token buckets.
 * <p>
 * Buckets are created full on first use. Each bucket is guarded by its own
 * monitor, so different keys never contend.
 */
public class InMemoryRateLimiter implements RateLimiterBackend {

    private static final class Bucket {
        private double tokens;
        private long lastRefillMillis;

        Bucket(double tokens, long nowMs) {
            this.tokens = tokens;
            this.lastRefillMillis = nowMs;
        }
    }

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult consume(String key, int limitPerMinute, int burst) {
        return consume(key, limitPerMinute, burst, System.currentTimeMillis());
    }

    /**
     * Consume with an explicit timestamp (useful for testing).
     */
    public RateLimitResult consume(String key, int limitPerMinute, int burst, long nowMs) {
        int capacity = RateLimiterBackend.capacity(limitPerMinute, burst);
        int rate = Math.max(0, limitPerMinute);
        Bucket bucket = buckets.computeIfAbsent(key, k -> new Bucket(capacity, nowMs));

        synchronized (bucket) {
            long elapsed = Math.max(0, nowMs - bucket.lastRefillMillis);
            bucket.tokens = Math.min(capacity, bucket.tokens + (double) elapsed * rate / MILLIS_PER_MINUTE);
            bucket.lastRefillMillis = Math.max(bucket.lastRefillMillis, nowMs);

            if (bucket.tokens >= 1.0) {
                bucket.tokens -= 1.0;
                return RateLimitResult.allowed((int) Math.floor(bucket.tokens));
            }
            long retryAfter = rate > 0
                    ? (long) Math.ceil((1.0 - bucket.tokens) * MILLIS_PER_MINUTE / rate)
                    : Long.MAX_VALUE;
            return RateLimitResult.limited(0, retryAfter);
        }
    }

    public int size() {
        return buckets.size();
    }
}
