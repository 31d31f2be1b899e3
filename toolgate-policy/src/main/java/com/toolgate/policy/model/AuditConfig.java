package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audit verbosity. By default only an argument key summary is recorded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("include_result") boolean includeResult,
        @JsonProperty("include_argument_values") boolean includeArgumentValues) {

    public static final AuditConfig DEFAULT = new AuditConfig(true, false, false);

    @JsonCreator
    public static AuditConfig fromJson(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("include_result") Boolean includeResult,
            @JsonProperty("include_argument_values") Boolean includeArgumentValues) {
        return new AuditConfig(
                enabled == null || enabled,
                Boolean.TRUE.equals(includeResult),
                Boolean.TRUE.equals(includeArgumentValues));
    }
}
