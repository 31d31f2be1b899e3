package com.toolgate.enforcer.pipeline;

import com.toolgate.enforcer.redact.ResultRedactor;
import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.EnforcementLayer;
import com.toolgate.policy.model.Policy;
import com.toolgate.policy.model.RedactConfig;
import com.toolgate.policy.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EnforcementPipelineTest {

    private static final Policy POLICY = Policy.builder().policyId("p").version("1").build();

    /** Guard with a fixed answer that records when it ran. */
    private record FixedGuard(EnforcementLayer layer, boolean allow, List<EnforcementLayer> trace)
            implements GuardLayer {

        @Override
        public Decision check(CallContext context) {
            trace.add(layer);
            return allow
                    ? Decision.allow(layer.label() + " ok", "p", layer)
                    : Decision.deny(layer.label() + " says no", "p", null, layer);
        }
    }

    private static CallContext context() {
        return new CallContext(ToolCall.of("t", Map.of("a", 1)), POLICY);
    }

    @Test
    void layersRunInOrder_thenToolExecutes() {
        List<EnforcementLayer> trace = new ArrayList<>();
        EnforcementPipeline pipeline = new EnforcementPipeline(List.of(
                new FixedGuard(EnforcementLayer.RATE_LIMIT, true, trace),
                new FixedGuard(EnforcementLayer.VALIDATE, true, trace),
                new FixedGuard(EnforcementLayer.AUTHORIZE, true, trace),
                new FixedGuard(EnforcementLayer.DETECT_ATTACKS, true, trace)), null);

        PipelineOutcome outcome = pipeline.run(context(), args -> args.get("a"));

        assertEquals(List.of(EnforcementLayer.RATE_LIMIT, EnforcementLayer.VALIDATE,
                EnforcementLayer.AUTHORIZE, EnforcementLayer.DETECT_ATTACKS), trace);
        PipelineOutcome.Allowed allowed = assertInstanceOf(PipelineOutcome.Allowed.class, outcome);
        assertEquals(1, allowed.result());
        assertEquals(EnforcementLayer.AUTHORIZE, allowed.decision().layer());
    }

    @Test
    void firstDenialStopsEverything() {
        List<EnforcementLayer> trace = new ArrayList<>();
        AtomicInteger invocations = new AtomicInteger();
        EnforcementPipeline pipeline = new EnforcementPipeline(List.of(
                new FixedGuard(EnforcementLayer.RATE_LIMIT, true, trace),
                new FixedGuard(EnforcementLayer.VALIDATE, false, trace),
                new FixedGuard(EnforcementLayer.AUTHORIZE, true, trace)), null);

        PipelineOutcome outcome = pipeline.run(context(), args -> invocations.incrementAndGet());

        assertEquals(List.of(EnforcementLayer.RATE_LIMIT, EnforcementLayer.VALIDATE), trace);
        assertEquals(0, invocations.get());
        assertEquals("validate says no", assertInstanceOf(PipelineOutcome.Denied.class, outcome).decision().reason());
    }

    @Test
    void toolException_becomesFailed() {
        EnforcementPipeline pipeline = new EnforcementPipeline(List.of(), null);
        Exception boom = new IOException("boom");

        PipelineOutcome outcome = pipeline.run(context(), args -> {
            throw boom;
        });

        PipelineOutcome.Failed failed = assertInstanceOf(PipelineOutcome.Failed.class, outcome);
        assertSame(boom, failed.cause());
        assertTrue(failed.decision().allowed());
    }

    @Test
    void toolError_becomesFailed() {
        EnforcementPipeline pipeline = new EnforcementPipeline(List.of(), null);
        StackOverflowError overflow = new StackOverflowError();

        PipelineOutcome outcome = pipeline.run(context(), args -> {
            throw overflow;
        });

        assertSame(overflow, assertInstanceOf(PipelineOutcome.Failed.class, outcome).cause());
    }

    @Test
    void throwingGuard_failsAtItsLayer() {
        List<EnforcementLayer> trace = new ArrayList<>();
        AtomicInteger invocations = new AtomicInteger();
        IllegalStateException outage = new IllegalStateException("backend down");
        GuardLayer broken = new GuardLayer() {
            @Override
            public EnforcementLayer layer() {
                return EnforcementLayer.VALIDATE;
            }

            @Override
            public Decision check(CallContext context) {
                throw outage;
            }
        };
        EnforcementPipeline pipeline = new EnforcementPipeline(List.of(
                new FixedGuard(EnforcementLayer.RATE_LIMIT, true, trace),
                broken,
                new FixedGuard(EnforcementLayer.AUTHORIZE, true, trace)), null);

        PipelineOutcome outcome = pipeline.run(context(), args -> invocations.incrementAndGet());

        PipelineOutcome.Failed failed = assertInstanceOf(PipelineOutcome.Failed.class, outcome);
        assertSame(outage, failed.cause());
        assertFalse(failed.decision().allowed());
        assertEquals(EnforcementLayer.VALIDATE, failed.decision().layer());
        assertEquals("validate layer failed: IllegalStateException", failed.decision().reason());
        assertEquals(List.of(EnforcementLayer.RATE_LIMIT), trace);
        assertEquals(0, invocations.get());
    }

    @Test
    void resultRedactedAfterExecution() {
        EnforcementPipeline pipeline = new EnforcementPipeline(List.of(),
                new ResultRedactor(RedactConfig.defaults()));

        PipelineOutcome outcome = pipeline.run(context(), args -> Map.of("token", "abc", "owner", "o@p.com"));

        assertEquals(Map.of("token", "[REDACTED]", "owner", "[REDACTED_EMAIL]"),
                assertInstanceOf(PipelineOutcome.Allowed.class, outcome).result());
    }
}
