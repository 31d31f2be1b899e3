package com.toolgate.enforcer.pipeline;

import com.toolgate.policy.PolicyEngine;
import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.EnforcementLayer;

/**
 * Delegates to the {@link PolicyEngine}.
 */
public class AuthorizationLayer implements GuardLayer {

    private final PolicyEngine engine;

    public AuthorizationLayer(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    public EnforcementLayer layer() {
        return EnforcementLayer.AUTHORIZE;
    }

    @Override
    public Decision check(CallContext context) {
        return engine.evaluate(context.getCall());
    }
}
