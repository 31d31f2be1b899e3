package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Outcome of one enforcement layer. Once a decision with
 * {@code allowed=false} is produced the call is terminal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
        boolean allowed,
        String reason,
        String policyId,
        String remediation,
        EnforcementLayer layer) {

    public Decision {
        Objects.requireNonNull(layer, "layer");
    }

    public static Decision allow(String reason, String policyId, EnforcementLayer layer) {
        return new Decision(true, reason, policyId, null, layer);
    }

    public static Decision deny(String reason, String policyId, String remediation, EnforcementLayer layer) {
        return new Decision(false, reason, policyId, remediation, layer);
    }

    public boolean denied() {
        return !allowed;
    }
}
