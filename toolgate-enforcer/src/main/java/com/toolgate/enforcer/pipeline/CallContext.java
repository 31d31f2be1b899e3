package com.toolgate.enforcer.pipeline;

import com.toolgate.policy.model.Policy;
import com.toolgate.policy.model.ToolCall;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-call state threaded through the pipeline. Owned by a single call and
 * never shared between threads.
 */
@Getter
public class CallContext {

    private final ToolCall call;
    private final Policy policy;
    private final long startNanos;
    private final Set<String> flags = new LinkedHashSet<>();
    private final Map<String, Object> meta = new LinkedHashMap<>();

    public CallContext(ToolCall call, Policy policy) {
        this.call = call;
        this.policy = policy;
        this.startNanos = System.nanoTime();
    }

    public String policyId() {
        return policy.policyId();
    }

    /**
     * Record a detection that was allowed through.
     */
    public void addFlag(String flag) {
        flags.add(flag);
    }

    public Set<String> getFlags() {
        return Collections.unmodifiableSet(flags);
    }

    public void putMeta(String key, Object value) {
        meta.put(key, value);
    }

    public Map<String, Object> getMeta() {
        return Collections.unmodifiableMap(meta);
    }

    public long latencyMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
