package com.toolgate.enforcer.pipeline;

import com.toolgate.enforcer.ToolFunction;
import com.toolgate.enforcer.redact.ResultRedactor;
import com.toolgate.policy.PolicyEngine;
import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.EnforcementLayer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs guard layers in order, executes the tool, then redacts its result.
 * <p>
 * The first denying guard ends the call; the tool is never invoked after a
 * denial. No lock is held while the tool runs. Anything thrown by a guard, the
 * tool or the redactor ends in {@link PipelineOutcome.Failed}, so every call
 * has a terminal outcome to audit.
 */
@Slf4j
public class EnforcementPipeline {

    private final List<GuardLayer> guards;
    private final ResultRedactor redactor;

    /**
     * @param guards   pre-execution layers in evaluation order
     * @param redactor result redactor, or {@code null} to return results as-is
     */
    public EnforcementPipeline(List<GuardLayer> guards, ResultRedactor redactor) {
        this.guards = List.copyOf(guards);
        this.redactor = redactor;
    }

    public PipelineOutcome run(CallContext context, ToolFunction tool) {
        String toolName = context.getCall().toolName();
        Decision authorization = null;

        for (GuardLayer guard : guards) {
            Decision decision;
            try {
                decision = guard.check(context);
            } catch (RuntimeException e) {
                log.warn("Guard {} failed for tool {}", guard.layer().label(), toolName, e);
                return new PipelineOutcome.Failed(layerFailure(guard.layer(), context, e), e);
            }
            if (decision.denied()) {
                log.debug("Tool {} denied at {}: {}", toolName, guard.layer().label(), decision.reason());
                return new PipelineOutcome.Denied(decision);
            }
            if (guard.layer() == EnforcementLayer.AUTHORIZE) {
                authorization = decision;
            }
        }
        if (authorization == null) {
            authorization = Decision.allow(PolicyEngine.ALLOW_REASON, context.policyId(), EnforcementLayer.EXECUTE);
        }

        Object result;
        try {
            result = tool.invoke(context.getCall().arguments());
        } catch (Throwable t) {
            log.debug("Tool {} failed: {}", toolName, t.getClass().getName());
            return new PipelineOutcome.Failed(authorization, t);
        }

        if (redactor == null) {
            return new PipelineOutcome.Allowed(result, authorization);
        }
        try {
            return new PipelineOutcome.Allowed(redactor.redact(result), authorization);
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Redaction of {} result failed: {}", toolName, e.getClass().getName());
            Decision failed = Decision.deny("result redaction failed", context.policyId(),
                    null, EnforcementLayer.REDACT);
            return new PipelineOutcome.Failed(failed, e);
        }
    }

    private static Decision layerFailure(EnforcementLayer layer, CallContext context, RuntimeException e) {
        return Decision.deny(layer.label() + " layer failed: " + e.getClass().getSimpleName(),
                context.policyId(), null, layer);
    }
}
