package com.toolgate.enforcer.audit;

import com.toolgate.enforcer.pipeline.CallContext;
import com.toolgate.enforcer.pipeline.PipelineOutcome;
import com.toolgate.enforcer.ratelimit.RateLimitLayer;
import com.toolgate.enforcer.redact.ResultRedactor;
import com.toolgate.policy.model.AuditConfig;
import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.EnforcementLayer;
import com.toolgate.policy.model.RedactConfig;
import com.toolgate.policy.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the audit event for a finished call and hands it to the sink.
 * <p>
 * Sink failures are logged and never change the outcome of the call.
 */
@Slf4j
public class AuditEmitter {

    public static final String ACTION = "tool_call";

    private final AuditSink sink;
    private final AuditConfig config;
    private final ResultRedactor redactor;
    private final Clock clock;

    public AuditEmitter(AuditSink sink, AuditConfig config) {
        this(sink, config, RedactConfig.DEFAULT_DENY_KEYS);
    }

    public AuditEmitter(AuditSink sink, AuditConfig config, Collection<String> denyKeys) {
        this(sink, config, denyKeys, Clock.systemUTC());
    }

    AuditEmitter(AuditSink sink, AuditConfig config, Collection<String> denyKeys, Clock clock) {
        this.sink = sink;
        this.config = config;
        this.redactor = ResultRedactor.forKeys(denyKeys);
        this.clock = clock;
    }

    /**
     * Emit the event for {@code outcome}. Returns the event, or empty when
     * auditing is disabled.
     */
    public Optional<AuditEvent> emit(CallContext context, PipelineOutcome outcome) {
        if (!config.enabled()) {
            return Optional.empty();
        }
        AuditEvent event = build(context, outcome);
        try {
            sink.emit(event);
        } catch (RuntimeException e) {
            log.error("Audit sink failed for tool {} (request {})",
                    event.getToolName(), event.getRequestId(), e);
        }
        return Optional.of(event);
    }

    public AuditEvent build(CallContext context, PipelineOutcome outcome) {
        ToolCall call = context.getCall();
        Decision decision = outcome.decision();

        AuditEvent.AuditEventBuilder builder = AuditEvent.builder()
                .timestamp(call.timestamp() != null ? call.timestamp() : Instant.now(clock).toString())
                .action(ACTION)
                .toolName(call.toolName())
                .policyId(context.policyId())
                .actor(call.actor())
                .requestId(call.requestId())
                .latencyMs(context.latencyMillis())
                .argumentsSummary(AuditEvent.ArgumentsSummary.of(call.arguments()));

        if (outcome instanceof PipelineOutcome.Allowed allowed) {
            builder.decision(AuditEvent.ALLOW)
                    .reason(decision.reason())
                    .layer(labelOf(decision.layer()));
            if (config.includeResult() && allowed.result() != null) {
                builder.result(redactor.redact(allowed.result()));
            }
        } else if (outcome instanceof PipelineOutcome.Denied) {
            builder.decision(AuditEvent.DENY)
                    .reason(decision.reason())
                    .layer(labelOf(decision.layer()));
        } else if (outcome instanceof PipelineOutcome.Failed failed) {
            builder.decision(AuditEvent.ERROR);
            if (decision.allowed()) {
                builder.reason("tool execution failed: " + failed.cause().getClass().getSimpleName())
                        .layer(EnforcementLayer.EXECUTE.label());
            } else {
                builder.reason(decision.reason())
                        .layer(labelOf(decision.layer()));
            }
        }

        if (!context.getFlags().isEmpty()) {
            builder.flags(List.copyOf(context.getFlags()));
        }
        Object rateLimit = context.getMeta().get(RateLimitLayer.META_KEY);
        if (rateLimit instanceof Map<?, ?> meta) {
            @SuppressWarnings("unchecked")
            Map<String, Object> typed = (Map<String, Object>) meta;
            builder.rateLimit(Collections.unmodifiableMap(new LinkedHashMap<>(typed)));
        }
        if (!call.client().isEmpty()) {
            builder.client(redactor.redact(call.client()));
        }
        if (config.includeArgumentValues()) {
            builder.arguments(redactor.redact(call.arguments()));
        }
        return builder.build();
    }

    private static String labelOf(EnforcementLayer layer) {
        return layer != null ? layer.label() : null;
    }
}
