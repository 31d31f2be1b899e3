package com.toolgate.enforcer.ratelimit;

import com.toolgate.enforcer.pipeline.CallContext;
import com.toolgate.enforcer.pipeline.GuardLayer;
import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.EnforcementLayer;
import com.toolgate.policy.model.RateLimitConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admits calls against a token bucket keyed by the configured scope.
 */
public class RateLimitLayer implements GuardLayer {

    public static final String META_KEY = "rate_limit";
    public static final String REASON = "rate limit exceeded";

    private final RateLimitConfig config;
    private final RateLimiterBackend backend;

    public RateLimitLayer(RateLimitConfig config, RateLimiterBackend backend) {
        this.config = config;
        this.backend = backend;
    }

    @Override
    public EnforcementLayer layer() {
        return EnforcementLayer.RATE_LIMIT;
    }

    @Override
    public Decision check(CallContext context) {
        if (!config.active()) {
            return Decision.allow("rate limit disabled", context.policyId(), EnforcementLayer.RATE_LIMIT);
        }
        String key = config.scope().keyFor(context.getCall());
        RateLimitResult result = backend.consume(key, config.limitPerMinute(), config.burst());

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("limit", config.limitPerMinute());
        meta.put("burst", config.capacity());
        meta.put("remaining", result.remaining());
        context.putMeta(META_KEY, meta);

        if (!result.allowed()) {
            return Decision.deny(REASON, context.policyId(),
                    "Retry after " + result.retryAfterMillis() + " ms.", EnforcementLayer.RATE_LIMIT);
        }
        return Decision.allow("within rate limit", context.policyId(), EnforcementLayer.RATE_LIMIT);
    }
}
