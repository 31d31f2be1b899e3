package com.toolgate.enforcer.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One audit record per tool call. Argument values and results appear only
 * when the audit config asks for them, and always in redacted form.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"timestamp", "action", "tool_name", "decision", "reason", "policy_id", "actor",
        "request_id", "layer", "latency_ms", "arguments_summary", "flags", "rate_limit"})
public class AuditEvent {

    public static final String ALLOW = "allow";
    public static final String DENY = "deny";
    public static final String ERROR = "error";

    String timestamp;
    String action;
    @JsonProperty("tool_name")
    String toolName;
    String decision;
    String reason;
    @JsonProperty("policy_id")
    String policyId;
    String actor;
    @JsonProperty("request_id")
    String requestId;
    String layer;
    @JsonProperty("latency_ms")
    Long latencyMs;
    @JsonProperty("arguments_summary")
    ArgumentsSummary argumentsSummary;
    List<String> flags;
    @JsonProperty("rate_limit")
    Map<String, Object> rateLimit;
    Object client;
    Object arguments;
    Object result;

    /**
     * Sorted argument names and their count.
     */
    public record ArgumentsSummary(
            @JsonProperty("keys") List<String> keys,
            @JsonProperty("key_count") int keyCount) {

        public static ArgumentsSummary of(Map<String, ?> arguments) {
            List<String> keys = arguments.keySet().stream().sorted().toList();
            return new ArgumentsSummary(keys, keys.size());
        }
    }
}
