package com.toolgate.policy;

import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.EnforcementLayer;
import lombok.Getter;

/**
 * Structured denial returned to the caller when any enforcement layer rejects
 * a tool call.
 */
@Getter
public class PolicyDeniedException extends RuntimeException {

    private final Decision decision;

    public PolicyDeniedException(Decision decision) {
        super("Denied: " + decision.reason());
        this.decision = decision;
    }

    public String getReason() {
        return decision.reason();
    }

    public String getPolicyId() {
        return decision.policyId();
    }

    public EnforcementLayer getLayer() {
        return decision.layer();
    }

    public String getRemediation() {
        return decision.remediation();
    }
}
