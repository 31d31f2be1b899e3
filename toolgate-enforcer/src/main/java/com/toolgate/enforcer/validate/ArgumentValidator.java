package com.toolgate.enforcer.validate;

import com.toolgate.common.json.JsonSupport;
import com.toolgate.enforcer.pipeline.CallContext;
import com.toolgate.enforcer.pipeline.GuardLayer;
import com.toolgate.policy.ToolNameMatcher;
import com.toolgate.policy.model.AllowRule;
import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.EnforcementLayer;
import com.toolgate.policy.model.Policy;
import com.toolgate.policy.model.ToolCall;
import com.toolgate.policy.model.ValidateConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on arguments: no undeclared keys and a bounded JSON
 * payload size. Runs before authorization.
 */
public class ArgumentValidator implements GuardLayer {

    public static final String UNKNOWN_REMEDIATION = "Remove unknown arguments.";
    public static final String SIZE_REMEDIATION = "Reduce arguments payload size.";

    @Override
    public EnforcementLayer layer() {
        return EnforcementLayer.VALIDATE;
    }

    @Override
    public Decision check(CallContext context) {
        Policy policy = context.getPolicy();
        return validate(context.getCall(), policy.validate(), policy);
    }

    public static Decision validate(ToolCall call, ValidateConfig config, Policy policy) {
        if (config.rejectUnknownArgs()) {
            List<String> unknown = unknownArguments(call, policy);
            if (!unknown.isEmpty()) {
                return Decision.deny("unknown argument: " + unknown, policy.policyId(),
                        UNKNOWN_REMEDIATION, EnforcementLayer.VALIDATE);
            }
        }
        if (config.hasSizeLimit()) {
            long size = JsonSupport.payloadSizeBytes(call.arguments());
            if (size > config.maxArgBytes()) {
                return Decision.deny("argument payload too large (> " + config.maxArgBytes() + " bytes)",
                        policy.policyId(), SIZE_REMEDIATION, EnforcementLayer.VALIDATE);
            }
        }
        return Decision.allow("arguments valid", policy.policyId(), EnforcementLayer.VALIDATE);
    }

    /**
     * Argument keys not declared by any allow rule for the call's tool,
     * sorted. Roles are not considered.
     */
    static List<String> unknownArguments(ToolCall call, Policy policy) {
        Set<String> declared = new HashSet<>();
        for (AllowRule rule : policy.allowRules()) {
            if (ToolNameMatcher.matches(rule.tool(), call.toolName())) {
                declared.addAll(rule.constraints().keySet());
            }
        }
        List<String> unknown = new ArrayList<>();
        for (String key : call.arguments().keySet()) {
            if (!declared.contains(key)) {
                unknown.add(key);
            }
        }
        Collections.sort(unknown);
        return unknown;
    }
}
