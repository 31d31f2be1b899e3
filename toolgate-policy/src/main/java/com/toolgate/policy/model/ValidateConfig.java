package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolgate.policy.PolicyConfigurationException;

/**
 * Structural argument checks. {@code maxArgBytes <= 0} means no size limit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidateConfig(
        @JsonProperty("reject_unknown_args") boolean rejectUnknownArgs,
        @JsonProperty("max_arg_bytes") long maxArgBytes) {

    public static final ValidateConfig DISABLED = new ValidateConfig(false, 0);

    public ValidateConfig {
        if (maxArgBytes < 0) {
            throw new PolicyConfigurationException("max_arg_bytes must not be negative");
        }
    }

    public boolean hasSizeLimit() {
        return maxArgBytes > 0;
    }
}
