package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolgate.policy.PolicyConfigurationException;

/**
 * Token-bucket admission settings. {@code burst <= 0} falls back to
 * {@code limitPerMinute} as the bucket capacity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RateLimitConfig(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("limit_per_minute") int limitPerMinute,
        @JsonProperty("burst") int burst,
        @JsonProperty("scope") RateLimitScope scope) {

    public static final RateLimitConfig DISABLED = new RateLimitConfig(false, 0, 0, RateLimitScope.ACTOR);

    public RateLimitConfig {
        if (limitPerMinute < 0 || burst < 0) {
            throw new PolicyConfigurationException("rate_limit values must not be negative");
        }
        scope = scope != null ? scope : RateLimitScope.ACTOR;
    }

    public boolean active() {
        return enabled && limitPerMinute > 0;
    }

    public int capacity() {
        return Math.max(1, burst > 0 ? burst : limitPerMinute);
    }
}
