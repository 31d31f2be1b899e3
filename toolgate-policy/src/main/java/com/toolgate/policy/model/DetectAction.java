package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.toolgate.policy.PolicyConfigurationException;

/**
 * Consequence of a positive attack detection.
 */
public enum DetectAction {
    /** Reject the call. */
    DENY,
    /** Let the call through and annotate its audit event. */
    FLAG;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DetectAction fromLabel(String label) {
        if (label == null)
            return DENY;
        return switch (label.trim().toLowerCase()) {
            case "deny" -> DENY;
            case "flag", "allow" -> FLAG;
            default -> throw new PolicyConfigurationException("on_detect must be 'deny' or 'flag', got: " + label);
        };
    }
}
