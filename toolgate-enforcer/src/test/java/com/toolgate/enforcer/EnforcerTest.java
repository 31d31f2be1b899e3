package com.toolgate.enforcer;

import com.toolgate.enforcer.audit.AuditEvent;
import com.toolgate.enforcer.audit.CollectingAuditSink;
import com.toolgate.enforcer.identity.Identity;
import com.toolgate.enforcer.ratelimit.InMemoryRateLimiter;
import com.toolgate.enforcer.ratelimit.RateLimiterBackend;
import com.toolgate.policy.PolicyDeniedException;
import com.toolgate.policy.config.PolicyLoader;
import com.toolgate.policy.model.AllowRule;
import com.toolgate.policy.model.AuditConfig;
import com.toolgate.policy.model.Constraint;
import com.toolgate.policy.model.ConstraintType;
import com.toolgate.policy.model.DetectAction;
import com.toolgate.policy.model.DetectAttacksConfig;
import com.toolgate.policy.model.EnforcementLayer;
import com.toolgate.policy.model.Policy;
import com.toolgate.policy.model.RateLimitConfig;
import com.toolgate.policy.model.RateLimitScope;
import com.toolgate.policy.model.ToolCall;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EnforcerTest {

    private static Policy supportPolicy;

    private CollectingAuditSink sink;
    private AtomicInteger invocations;
    private ToolFunction getUser;

    @BeforeAll
    static void loadPolicy() {
        try (InputStream in = EnforcerTest.class.getResourceAsStream("/policies/support-bot.json")) {
            assertNotNull(in, "policy fixture missing");
            supportPolicy = new PolicyLoader(Map.of()).parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @BeforeEach
    void setUp() {
        sink = new CollectingAuditSink();
        invocations = new AtomicInteger();
        getUser = args -> {
            invocations.incrementAndGet();
            return Map.of("id", args.get("user_id"), "email", "jane@example.com", "ssn", "078-05-1120");
        };
    }

    private Enforcer enforcer(Policy policy) {
        return new Enforcer(policy, sink);
    }

    private static ToolCall call(String tool, Map<String, Object> args, String... roles) {
        return ToolCall.builder()
                .toolName(tool)
                .arguments(args)
                .roles(Set.of(roles))
                .actor("agent-7")
                .requestId("req-" + tool)
                .build();
    }

    // ==================== Authorization ====================

    @Nested
    class GetUserScenario {

        @Test
        void validId_allowedAndRedacted() {
            Object result = enforcer(supportPolicy).enforce(call("get_user", Map.of("user_id", 42), "support"), getUser);

            assertEquals(Map.of("id", 42, "email", "[REDACTED_EMAIL]", "ssn", "[REDACTED]"), result);
            assertEquals(1, invocations.get());

            AuditEvent event = sink.single();
            assertEquals(AuditEvent.ALLOW, event.getDecision());
            assertEquals("Matched allow rule", event.getReason());
            assertEquals("support-bot", event.getPolicyId());
            assertEquals("agent-7", event.getActor());
            assertEquals(List.of("user_id"), event.getArgumentsSummary().keys());
            assertNull(event.getResult());
        }

        @Test
        void stringId_deniedWithoutInvokingTool() {
            PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer(supportPolicy)
                    .enforce(call("get_user", Map.of("user_id", "42"), "support"), getUser));

            assertEquals("type mismatch: argument 'user_id' must be integer", e.getReason());
            assertEquals("support-bot", e.getPolicyId());
            assertEquals(EnforcementLayer.AUTHORIZE, e.getLayer());
            assertEquals("Denied: type mismatch: argument 'user_id' must be integer", e.getMessage());
            assertEquals(0, invocations.get());
            assertEquals(AuditEvent.DENY, sink.single().getDecision());
        }

        @Test
        void wrongRole_denied() {
            PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer(supportPolicy)
                    .enforce(call("get_user", Map.of("user_id", 42), "viewer"), getUser));
            assertEquals("role not permitted for this tool", e.getReason());
            assertEquals(0, invocations.get());
        }

        @Test
        void conditionalDenyRule_winsOverAllow() {
            PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer(supportPolicy)
                    .enforce(call("get_user", Map.of("user_id", 42, "include", "billing"), "admin"), getUser));
            assertEquals("billing data requires a ticket", e.getReason());
            assertEquals("Request access via policy update.", e.getRemediation());
        }
    }

    @Nested
    class EmployeeIdPattern {

        private final Policy directory = Policy.builder()
                .policyId("employee-directory")
                .version("1")
                .allowRules(List.of(new AllowRule("get_user", List.of("support"), Map.of(
                        "user_id", Constraint.builder()
                                .type(ConstraintType.STRING)
                                .required(true)
                                .pattern("^EMP[0-9]{6}$")
                                .build()))))
                .build();

        @Test
        void matchingId_allowed() {
            Object result = enforcer(directory).enforce(call("get_user", Map.of("user_id", "EMP123456"), "support"),
                    args -> Map.of("id", args.get("user_id"), "name", "Jane"));

            assertEquals(Map.of("id", "EMP123456", "name", "Jane"), result);
            AuditEvent event = sink.single();
            assertEquals(AuditEvent.ALLOW, event.getDecision());
            assertEquals("employee-directory", event.getPolicyId());
        }

        @Test
        void malformedId_deniedWithoutInvokingTool() {
            PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer(directory)
                    .enforce(call("get_user", Map.of("user_id", "INVALID"), "support"), getUser));

            assertEquals("argument 'user_id' does not match pattern", e.getReason());
            assertEquals("Fix tool arguments to satisfy policy constraints.", e.getRemediation());
            assertEquals(EnforcementLayer.AUTHORIZE, e.getLayer());
            assertEquals(0, invocations.get());

            AuditEvent event = sink.single();
            assertEquals(AuditEvent.DENY, event.getDecision());
            assertEquals("argument 'user_id' does not match pattern", event.getReason());
            assertEquals("authorize", event.getLayer());
        }
    }

    @Test
    void unlistedTool_defaultDeny() {
        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
                () -> enforcer(supportPolicy).enforce(call("launch", Map.of()), getUser));
        assertEquals("no matching allow rule / default deny", e.getReason());
        assertEquals(0, invocations.get());
    }

    @Test
    void globDenyRule() {
        PolicyDeniedException e = assertThrows(PolicyDeniedException.class,
                () -> enforcer(supportPolicy).enforce(call("delete_user", Map.of(), "admin"), getUser));
        assertEquals("destructive tools are disabled", e.getReason());
    }

    // ==================== Validation ====================

    @Test
    void unknownArgument_rejectedBeforeAuthorization() {
        PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer(supportPolicy)
                .enforce(call("get_user", Map.of("user_id", 1, "debug", true), "support"), getUser));
        assertEquals("unknown argument: [debug]", e.getReason());
        assertEquals(EnforcementLayer.VALIDATE, e.getLayer());
        assertEquals(0, invocations.get());
    }

    @Test
    void oversizedPayload_rejected() {
        String big = "x".repeat(4096);
        PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer(supportPolicy)
                .enforce(call("search_docs", Map.of("query", big)), getUser));
        assertEquals("argument payload too large (> 2048 bytes)", e.getReason());
    }

    // ==================== Attack detection ====================

    @Nested
    class Attacks {

        @Test
        void sqlInjection_denied() {
            PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer(supportPolicy)
                    .enforce(call("search_docs", Map.of("query", "x' OR '1'='1")), getUser));
            assertEquals("potential sql_injection detected in argument 'query'", e.getReason());
            assertEquals(EnforcementLayer.DETECT_ATTACKS, e.getLayer());
            assertEquals(0, invocations.get());
        }

        @Test
        void ssrf_denied() {
            PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer(supportPolicy)
                    .enforce(call("fetch_url", Map.of("url", "http://169.254.169.254/latest"), "admin"), getUser));
            assertEquals("potential ssrf detected in argument 'url'", e.getReason());
        }

        @Test
        void flagMode_allowsAndAnnotatesAudit() {
            Policy flagging = supportPolicy.toBuilder()
                    .detectAttacks(new DetectAttacksConfig(true, DetectAction.FLAG, null))
                    .build();
            Object result = enforcer(flagging).enforce(
                    call("search_docs", Map.of("query", "1 UNION SELECT password")), args -> "3 hits");

            assertEquals("3 hits", result);
            AuditEvent event = sink.single();
            assertEquals(AuditEvent.ALLOW, event.getDecision());
            assertEquals(List.of("sql_injection"), event.getFlags());
        }
    }

    // ==================== Rate limiting ====================

    @Test
    void rateLimit_perActor() {
        Policy tight = supportPolicy.toBuilder()
                .rateLimit(new RateLimitConfig(true, 1, 2, RateLimitScope.ACTOR))
                .build();
        Enforcer enforcer = new Enforcer(() -> tight, sink, new InMemoryRateLimiter());
        ToolCall c = call("get_user", Map.of("user_id", 1), "support");

        enforcer.enforce(c, getUser);
        enforcer.enforce(c, getUser);
        PolicyDeniedException e = assertThrows(PolicyDeniedException.class, () -> enforcer.enforce(c, getUser));

        assertEquals("rate limit exceeded", e.getReason());
        assertEquals(EnforcementLayer.RATE_LIMIT, e.getLayer());
        assertTrue(e.getRemediation().startsWith("Retry after "));
        assertEquals(2, invocations.get());
        assertEquals(3, sink.events().size());
        assertEquals(Map.of("limit", 1, "burst", 2, "remaining", 0), sink.events().get(2).getRateLimit());

        // other actors have their own bucket
        ToolCall other = c.toBuilder().actor("agent-8").build();
        assertNotNull(enforcer.enforce(other, getUser));
    }

    // ==================== Execution & audit ====================

    @Test
    void toolFailure_wrappedAndAuditedAsError() {
        IllegalStateException boom = new IllegalStateException("connection refused");
        ToolExecutionException e = assertThrows(ToolExecutionException.class, () -> enforcer(supportPolicy)
                .enforce(call("search_docs", Map.of("query", "refunds")), args -> {
                    throw boom;
                }));

        assertSame(boom, e.getCause());
        assertTrue(e.getDecision().allowed());
        AuditEvent event = sink.single();
        assertEquals(AuditEvent.ERROR, event.getDecision());
        assertEquals("execute", event.getLayer());
    }

    @Test
    void toolError_auditedThenRethrown() {
        AssertionError broken = new AssertionError("invariant violated");
        AssertionError thrown = assertThrows(AssertionError.class, () -> enforcer(supportPolicy)
                .enforce(call("search_docs", Map.of("query", "refunds")), args -> {
                    throw broken;
                }));

        assertSame(broken, thrown);
        AuditEvent event = sink.single();
        assertEquals(AuditEvent.ERROR, event.getDecision());
        assertEquals("execute", event.getLayer());
        assertEquals("tool execution failed: AssertionError", event.getReason());
    }

    @Test
    void rateLimiterBackendFailure_auditedAsLayerError() {
        IllegalStateException outage = new IllegalStateException("bucket store unreachable");
        RateLimiterBackend failing = (key, limitPerMinute, burst) -> {
            throw outage;
        };
        Enforcer enforcer = new Enforcer(() -> supportPolicy, sink, failing);

        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> enforcer.enforce(call("get_user", Map.of("user_id", 1), "support"), getUser));

        assertSame(outage, e.getCause());
        assertFalse(e.getDecision().allowed());
        assertEquals(EnforcementLayer.RATE_LIMIT, e.getDecision().layer());
        assertEquals("Enforcement failed at rate_limit: IllegalStateException", e.getMessage());
        assertEquals(0, invocations.get());

        AuditEvent event = sink.single();
        assertEquals(AuditEvent.ERROR, event.getDecision());
        assertEquals("rate_limit", event.getLayer());
        assertEquals("rate_limit layer failed: IllegalStateException", event.getReason());
    }

    @Test
    void concurrentCalls_shareOneBucket() throws Exception {
        Policy shared = supportPolicy.toBuilder()
                .rateLimit(new RateLimitConfig(true, 1, 10, RateLimitScope.GLOBAL))
                .build();
        Enforcer enforcer = new Enforcer(shared, sink);
        int threads = 8;
        int callsPerThread = 5;
        AtomicInteger allowed = new AtomicInteger();
        AtomicInteger limited = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                ToolCall c = call("search_docs", Map.of("query", "faq")).toBuilder().actor("agent-" + t).build();
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        try {
                            enforcer.enforce(c, getUser);
                            allowed.incrementAndGet();
                        } catch (PolicyDeniedException e) {
                            assertEquals("rate limit exceeded", e.getReason());
                            limited.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(10, allowed.get());
        assertEquals(threads * callsPerThread - 10, limited.get());
        assertEquals(10, invocations.get());
        assertEquals(threads * callsPerThread, sink.events().size());
    }

    @Test
    void exactlyOneAuditEventPerCall() {
        Enforcer enforcer = enforcer(supportPolicy);
        List<ToolCall> calls = List.of(
                call("get_user", Map.of("user_id", 1), "support"),
                call("get_user", Map.of("user_id", 0), "support"),
                call("get_user", Map.of("user_id", 1, "x", 1), "support"),
                call("unknown_tool", Map.of()),
                call("search_docs", Map.of("query", "../../etc/passwd")));

        for (ToolCall c : calls) {
            try {
                enforcer.enforce(c, getUser);
            } catch (PolicyDeniedException expected) {
                assertFalse(expected.getDecision().allowed());
            }
        }

        assertEquals(calls.size(), sink.events().size());
        assertEquals(List.of("allow", "deny", "deny", "deny", "deny"),
                sink.events().stream().map(AuditEvent::getDecision).toList());
    }

    @Test
    void auditSinkFailure_doesNotChangeOutcome() {
        Enforcer enforcer = new Enforcer(supportPolicy, event -> {
            throw new IllegalStateException("audit store offline");
        });
        Object result = enforcer.enforce(call("get_user", Map.of("user_id", 5), "support"), getUser);
        assertNotNull(result);
        assertEquals(1, invocations.get());
    }

    @Test
    void auditDisabled_noEvents() {
        Policy quiet = supportPolicy.toBuilder().audit(new AuditConfig(false, false, false)).build();
        enforcer(quiet).enforce(call("get_user", Map.of("user_id", 5), "support"), getUser);
        assertTrue(sink.events().isEmpty());
    }

    @Test
    void argumentsPassedToToolUnchanged() {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        enforcer(supportPolicy).enforce(call("search_docs", Map.of("query", "refund policy", "limit", 5)), args -> {
            seen.set(args);
            return "ok";
        });
        assertEquals(Map.of("query", "refund policy", "limit", 5), seen.get());
    }

    // ==================== Binding & reload ====================

    @Test
    void boundTool_resolvesIdentityPerCall() {
        Map<String, Identity> tokens = Map.of(
                "tok-support", Identity.of("sam", "support"),
                "tok-viewer", Identity.of("vic", "viewer"));
        GuardedTool<String> tool = enforcer(supportPolicy).bind("get_user", getUser, tokens::get);

        assertEquals(7, ((Map<?, ?>) tool.call("tok-support", Map.of("user_id", 7))).get("id"));
        assertThrows(PolicyDeniedException.class, () -> tool.call("tok-viewer", Map.of("user_id", 7)));
        assertThrows(PolicyDeniedException.class, () -> tool.call("tok-missing", Map.of("user_id", 7)));

        assertEquals(List.of("sam", "vic"), sink.events().stream().map(AuditEvent::getActor).limit(2).toList());
        assertNotNull(sink.events().get(0).getRequestId());
    }

    @Test
    void anonymousBinding_allowedOnlyForRoleFreeRules() {
        GuardedTool<Object> search = enforcer(supportPolicy).bind("search_docs", args -> "found");
        assertEquals("found", search.call(Map.of("query", "pricing")));
    }

    @Test
    void policySupplier_swapTakesEffectOnNextCall() {
        AtomicReference<Policy> current = new AtomicReference<>(supportPolicy);
        Enforcer enforcer = new Enforcer(current::get, sink);
        ToolCall c = call("get_user", Map.of("user_id", 3), "support");

        assertNotNull(enforcer.enforce(c, getUser));

        current.set(supportPolicy.toBuilder().allowRules(List.of()).build());
        assertThrows(PolicyDeniedException.class, () -> enforcer.enforce(c, getUser));
        assertSame(current.get(), enforcer.currentPolicy());
    }
}
