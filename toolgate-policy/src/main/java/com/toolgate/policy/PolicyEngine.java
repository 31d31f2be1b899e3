package com.toolgate.policy;

import com.toolgate.policy.ConstraintMatcher.MatchOutcome;
import com.toolgate.policy.model.AllowRule;
import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.DefaultEffect;
import com.toolgate.policy.model.DenyRule;
import com.toolgate.policy.model.EnforcementLayer;
import com.toolgate.policy.model.Policy;
import com.toolgate.policy.model.ToolCall;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Authorizes tool calls against a {@link Policy}.
 * <p>
 * Deny rules are checked first and win outright. Allow rules are then tried
 * in document order; a rule whose constraints fail does not end evaluation,
 * the next matching rule gets its chance. When nothing allows the call the
 * policy default applies. Evaluation is pure: the same call against the same
 * policy always yields an equal decision.
 */
@Slf4j
public class PolicyEngine {

    public static final String ALLOW_REASON = "Matched allow rule";
    public static final String DENY_REMEDIATION = "Request access via policy update.";
    public static final String CONSTRAINT_REMEDIATION = "Fix tool arguments to satisfy policy constraints.";
    public static final String ROLE_REASON = "role not permitted for this tool";
    public static final String DEFAULT_DENY_REASON = "no matching allow rule / default deny";
    public static final String DEFAULT_ALLOW_REASON = "no matching allow rule / default allow";

    private record CompiledDeny(ToolNameMatcher matcher, DenyRule rule) {
    }

    private record CompiledAllow(ToolNameMatcher matcher, AllowRule rule) {
    }

    @Getter
    private final Policy policy;
    private final List<CompiledDeny> denyRules;
    private final List<CompiledAllow> allowRules;

    public PolicyEngine(Policy policy) {
        this.policy = policy;
        this.denyRules = policy.denyRules().stream()
                .map(r -> new CompiledDeny(ToolNameMatcher.compile(r.tool()), r))
                .toList();
        this.allowRules = policy.allowRules().stream()
                .map(r -> new CompiledAllow(ToolNameMatcher.compile(r.tool()), r))
                .toList();
    }

    public Decision evaluate(ToolCall call) {
        String policyId = policy.policyId();

        // ── Deny rules ──────────────────────────────────────────────────
        for (CompiledDeny deny : denyRules) {
            if (deny.matcher().matches(call.toolName()) && conditionHolds(deny.rule(), call.arguments())) {
                log.debug("Tool {} denied by deny rule '{}'", call.toolName(), deny.rule().tool());
                return Decision.deny(deny.rule().reason(), policyId, DENY_REMEDIATION, EnforcementLayer.AUTHORIZE);
            }
        }

        // ── Allow rules ─────────────────────────────────────────────────
        MatchOutcome firstFailure = null;
        boolean roleMismatch = false;
        for (CompiledAllow allow : allowRules) {
            if (!allow.matcher().matches(call.toolName()))
                continue;
            if (!allow.rule().permitsRoles(call.roles())) {
                roleMismatch = true;
                continue;
            }
            MatchOutcome outcome = ConstraintMatcher.matchAll(allow.rule().constraints(), call.arguments());
            if (outcome.ok()) {
                return Decision.allow(ALLOW_REASON, policyId, EnforcementLayer.AUTHORIZE);
            }
            if (firstFailure == null)
                firstFailure = outcome;
        }

        // ── Default ─────────────────────────────────────────────────────
        if (policy.defaultEffect() == DefaultEffect.ALLOW) {
            return Decision.allow(DEFAULT_ALLOW_REASON, policyId, EnforcementLayer.AUTHORIZE);
        }
        if (firstFailure != null) {
            return Decision.deny(firstFailure.reason(), policyId, CONSTRAINT_REMEDIATION, EnforcementLayer.AUTHORIZE);
        }
        if (roleMismatch) {
            return Decision.deny(ROLE_REASON, policyId, DENY_REMEDIATION, EnforcementLayer.AUTHORIZE);
        }
        return Decision.deny(DEFAULT_DENY_REASON, policyId, DENY_REMEDIATION, EnforcementLayer.AUTHORIZE);
    }

    /**
     * Allow rules whose tool pattern matches {@code toolName}, regardless of
     * roles.
     */
    public List<AllowRule> allowRulesFor(String toolName) {
        return allowRules.stream()
                .filter(a -> a.matcher().matches(toolName))
                .map(CompiledAllow::rule)
                .toList();
    }

    private static boolean conditionHolds(DenyRule rule, Map<String, Object> arguments) {
        if (rule.unconditional())
            return true;
        for (var entry : rule.condition().entrySet()) {
            if (!arguments.containsKey(entry.getKey()))
                return false;
            if (!ConstraintMatcher.literalEquals(entry.getValue(), arguments.get(entry.getKey())))
                return false;
        }
        return true;
    }
}
