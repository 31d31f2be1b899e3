package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A request to invoke a named tool on behalf of an actor.
 * <p>
 * Identity ({@code actor}, {@code roles}) is resolved before the call reaches
 * the enforcer. {@code client} carries free-form caller metadata such as
 * {@code session_id}. Instances are immutable.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCall(
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("arguments") Map<String, Object> arguments,
        @JsonProperty("roles") Set<String> roles,
        @JsonProperty("actor") String actor,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("client") Map<String, Object> client,
        @JsonProperty("timestamp") String timestamp) {

    public ToolCall {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("tool_name must not be blank");
        }
        toolName = toolName.trim();
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
        if (roles == null || roles.isEmpty()) {
            roles = Set.of();
        } else {
            Set<String> copy = new LinkedHashSet<>();
            for (String role : roles) {
                if (role != null && !role.isBlank()) {
                    copy.add(role.trim());
                }
            }
            roles = Collections.unmodifiableSet(copy);
        }
        client = client != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(client))
                : Map.of();
    }

    public static ToolCall of(String toolName, Map<String, Object> arguments) {
        return ToolCall.builder().toolName(toolName).arguments(arguments).build();
    }

    public boolean hasArgument(String name) {
        return arguments.containsKey(name);
    }

    public Object argument(String name) {
        return arguments.get(name);
    }

    /**
     * Session identifier from client metadata, if any.
     */
    public String sessionId() {
        Object value = client.get("session_id");
        return value != null ? Objects.toString(value) : null;
    }
}
