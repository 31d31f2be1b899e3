package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolgate.policy.PolicyConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Grants a tool to callers holding one of {@code roles} (any caller when
 * absent or empty), provided every declared constraint passes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AllowRule(
        @JsonProperty("tool") String tool,
        @JsonProperty("roles") List<String> roles,
        @JsonProperty("constraints") Map<String, Constraint> constraints) {

    public AllowRule {
        if (tool == null || tool.isBlank()) {
            throw new PolicyConfigurationException("allow rule requires a tool");
        }
        roles = roles != null ? List.copyOf(roles) : List.of();
        if (constraints == null || constraints.isEmpty()) {
            constraints = Map.of();
        } else {
            for (var entry : constraints.entrySet()) {
                if (entry.getValue() == null) {
                    throw new PolicyConfigurationException(
                            "allow rule for '" + tool + "' has an empty constraint for '" + entry.getKey() + "'");
                }
            }
            constraints = Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
        }
    }

    public AllowRule(String tool) {
        this(tool, null, null);
    }

    /**
     * True when this rule applies regardless of the caller's roles.
     */
    public boolean anyRole() {
        return roles.isEmpty();
    }

    public boolean permitsRoles(Set<String> callerRoles) {
        if (anyRole())
            return true;
        for (String role : roles) {
            if (callerRoles.contains(role))
                return true;
        }
        return false;
    }
}
