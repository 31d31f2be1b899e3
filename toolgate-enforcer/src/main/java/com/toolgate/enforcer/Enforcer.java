package com.toolgate.enforcer;

import com.toolgate.enforcer.audit.AuditEmitter;
import com.toolgate.enforcer.audit.AuditSink;
import com.toolgate.enforcer.audit.Slf4jAuditSink;
import com.toolgate.enforcer.detect.AttackDetector;
import com.toolgate.enforcer.identity.IdentityResolver;
import com.toolgate.enforcer.pipeline.AuthorizationLayer;
import com.toolgate.enforcer.pipeline.CallContext;
import com.toolgate.enforcer.pipeline.EnforcementPipeline;
import com.toolgate.enforcer.pipeline.PipelineOutcome;
import com.toolgate.enforcer.ratelimit.InMemoryRateLimiter;
import com.toolgate.enforcer.ratelimit.RateLimitLayer;
import com.toolgate.enforcer.ratelimit.RateLimiterBackend;
import com.toolgate.enforcer.redact.ResultRedactor;
import com.toolgate.enforcer.validate.ArgumentValidator;
import com.toolgate.policy.PolicyDeniedException;
import com.toolgate.policy.PolicyEngine;
import com.toolgate.policy.model.Policy;
import com.toolgate.policy.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Entry point: enforces a policy around tool invocations.
 * <p>
 * Each call is checked by rate limiting, argument validation, authorization
 * and attack detection, in that order. Only when all pass does the tool run;
 * its result is then redacted. Exactly one audit event is emitted per call,
 * whatever the outcome.
 * <p>
 * The policy is read from the supplier once per call, so a reloading
 * {@link com.toolgate.policy.config.PolicyService} can back an enforcer and
 * each call still sees a single policy snapshot.
 */
@Slf4j
public class Enforcer {

    private record Snapshot(Policy policy, EnforcementPipeline pipeline, AuditEmitter auditEmitter) {
    }

    private final Supplier<Policy> policySource;
    private final AuditSink auditSink;
    private final RateLimiterBackend rateLimiter;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    public Enforcer(Policy policy) {
        this(policy, new Slf4jAuditSink());
    }

    public Enforcer(Policy policy, AuditSink auditSink) {
        this(constant(policy), auditSink, new InMemoryRateLimiter());
    }

    public Enforcer(Supplier<Policy> policySource, AuditSink auditSink) {
        this(policySource, auditSink, new InMemoryRateLimiter());
    }

    public Enforcer(Supplier<Policy> policySource, AuditSink auditSink, RateLimiterBackend rateLimiter) {
        this.policySource = Objects.requireNonNull(policySource, "policySource");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    }

    /**
     * Run {@code call} through the pipeline and invoke {@code tool} if every
     * layer allows it.
     *
     * @return the tool's result, redacted per policy
     * @throws PolicyDeniedException  if any layer denies the call; the tool was not invoked
     * @throws ToolExecutionException if the tool, a layer or result redaction failed;
     *                                errors thrown by the tool are rethrown as-is after auditing
     */
    public Object enforce(ToolCall call, ToolFunction tool) {
        Snapshot current = snapshotFor(policySource.get());
        CallContext context = new CallContext(call, current.policy());

        PipelineOutcome outcome = current.pipeline().run(context, tool);
        current.auditEmitter().emit(context, outcome);

        if (outcome instanceof PipelineOutcome.Allowed allowed) {
            return allowed.result();
        }
        if (outcome instanceof PipelineOutcome.Denied denied) {
            log.warn("Denied tool call {} for actor {}: {} ({})", call.toolName(), call.actor(),
                    denied.decision().reason(), denied.decision().layer().label());
            throw new PolicyDeniedException(denied.decision());
        }
        PipelineOutcome.Failed failed = (PipelineOutcome.Failed) outcome;
        if (failed.cause() instanceof Error error) {
            throw error;
        }
        throw new ToolExecutionException(failed.decision(), failed.cause());
    }

    /**
     * Bind {@code tool} under {@code toolName}, resolving caller identity with
     * {@code identityResolver} on every invocation.
     */
    public <C> GuardedTool<C> bind(String toolName, ToolFunction tool, IdentityResolver<C> identityResolver) {
        return new GuardedTool<>(this, toolName, tool, identityResolver);
    }

    /**
     * Bind {@code tool} for anonymous callers.
     */
    public GuardedTool<Object> bind(String toolName, ToolFunction tool) {
        return bind(toolName, tool, IdentityResolver.anonymous());
    }

    /**
     * Policy in effect for the next call.
     */
    public Policy currentPolicy() {
        return snapshotFor(policySource.get()).policy();
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private Snapshot snapshotFor(Policy policy) {
        Objects.requireNonNull(policy, "policy source returned null");
        Snapshot existing = snapshot.get();
        if (existing != null && existing.policy() == policy) {
            return existing;
        }
        Snapshot created = build(policy);
        snapshot.set(created);
        log.debug("Enforcer using policy {} v{}", policy.policyId(), policy.version());
        return created;
    }

    private Snapshot build(Policy policy) {
        ResultRedactor redactor = policy.redact().enabled() ? new ResultRedactor(policy.redact()) : null;
        EnforcementPipeline pipeline = new EnforcementPipeline(List.of(
                new RateLimitLayer(policy.rateLimit(), rateLimiter),
                new ArgumentValidator(),
                new AuthorizationLayer(new PolicyEngine(policy)),
                new AttackDetector()), redactor);
        AuditEmitter emitter = new AuditEmitter(auditSink, policy.audit(), policy.redact().denyKeys());
        return new Snapshot(policy, pipeline, emitter);
    }

    private static Supplier<Policy> constant(Policy policy) {
        Objects.requireNonNull(policy, "policy");
        return () -> policy;
    }
}
