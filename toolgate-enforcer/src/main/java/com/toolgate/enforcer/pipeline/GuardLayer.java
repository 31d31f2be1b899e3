package com.toolgate.enforcer.pipeline;

import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.EnforcementLayer;

/**
 * A check that runs before the tool executes. Denials are returned, never
 * thrown.
 */
public interface GuardLayer {

    EnforcementLayer layer();

    Decision check(CallContext context);
}
