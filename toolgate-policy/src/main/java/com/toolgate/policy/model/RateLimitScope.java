package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.toolgate.policy.PolicyConfigurationException;

/**
 * What a rate-limit bucket is keyed on.
 */
public enum RateLimitScope {
    ACTOR("actor"),
    TOOL("tool"),
    SESSION("session"),
    ACTOR_TOOL("actor+tool"),
    GLOBAL("global");

    private static final String UNKNOWN = "unknown";

    private final String label;

    RateLimitScope(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static RateLimitScope fromLabel(String label) {
        if (label == null)
            return ACTOR;
        String normalized = label.trim().toLowerCase();
        for (RateLimitScope scope : values()) {
            if (scope.label.equals(normalized))
                return scope;
        }
        throw new PolicyConfigurationException("Unsupported rate limit scope: " + label);
    }

    /**
     * Bucket key for {@code call} under this scope.
     */
    public String keyFor(ToolCall call) {
        return switch (this) {
            case ACTOR -> "actor:" + orUnknown(call.actor());
            case TOOL -> "tool:" + call.toolName();
            case SESSION -> "session:" + orUnknown(call.sessionId());
            case ACTOR_TOOL -> "actor:" + orUnknown(call.actor()) + ":tool:" + call.toolName();
            case GLOBAL -> "global";
        };
    }

    private static String orUnknown(String value) {
        return value != null && !value.isBlank() ? value : UNKNOWN;
    }
}
