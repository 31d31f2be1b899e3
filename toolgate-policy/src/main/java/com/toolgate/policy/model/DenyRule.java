package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolgate.policy.PolicyConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Blocks a tool outright, or only when every argument listed in
 * {@code condition} equals the given literal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DenyRule(
        @JsonProperty("tool") String tool,
        @JsonProperty("condition") Map<String, Object> condition,
        @JsonProperty("reason") String reason) {

    public static final String DEFAULT_REASON = "Denied by policy";

    public DenyRule {
        if (tool == null || tool.isBlank()) {
            throw new PolicyConfigurationException("deny rule requires a tool");
        }
        condition = condition != null && !condition.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(condition))
                : Map.of();
        reason = reason != null && !reason.isBlank() ? reason : DEFAULT_REASON;
    }

    public boolean unconditional() {
        return condition.isEmpty();
    }
}
