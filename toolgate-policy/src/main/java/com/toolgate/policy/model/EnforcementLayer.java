package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stage that produced a {@link Decision}.
 */
public enum EnforcementLayer {
    RATE_LIMIT,
    VALIDATE,
    AUTHORIZE,
    DETECT_ATTACKS,
    EXECUTE,
    REDACT;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
