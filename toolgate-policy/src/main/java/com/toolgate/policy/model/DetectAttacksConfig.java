package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Heuristic injection scanning over the named argument fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DetectAttacksConfig(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("on_detect") DetectAction onDetect,
        @JsonProperty("fields") List<String> fields) {

    public static final List<String> DEFAULT_FIELDS = List.of("query", "sql", "where", "url", "path");

    public static final DetectAttacksConfig DISABLED = new DetectAttacksConfig(false, DetectAction.DENY, DEFAULT_FIELDS);

    public DetectAttacksConfig {
        onDetect = onDetect != null ? onDetect : DetectAction.DENY;
        fields = fields != null ? List.copyOf(fields) : DEFAULT_FIELDS;
    }

    @JsonCreator
    public static DetectAttacksConfig fromJson(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("on_detect") DetectAction onDetect,
            @JsonProperty("fields") List<String> fields) {
        return new DetectAttacksConfig(Boolean.TRUE.equals(enabled), onDetect, fields);
    }
}
