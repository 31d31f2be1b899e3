package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.toolgate.policy.PolicyConfigurationException;

/**
 * Outcome applied when no rule decides a call.
 */
public enum DefaultEffect {
    ALLOW,
    DENY;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DefaultEffect fromLabel(String label) {
        if (label == null)
            return DENY;
        return switch (label.trim().toLowerCase()) {
            case "allow" -> ALLOW;
            case "deny" -> DENY;
            default -> throw new PolicyConfigurationException("default must be 'allow' or 'deny', got: " + label);
        };
    }
}
