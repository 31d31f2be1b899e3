package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolgate.policy.PolicyConfigurationException;
import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * A parsed, immutable policy document. Reloading a policy always produces a
 * new instance.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Policy(
        @JsonProperty("policy_id") String policyId,
        @JsonProperty("version") String version,
        @JsonProperty("default") DefaultEffect defaultEffect,
        @JsonProperty("allow_rules") List<AllowRule> allowRules,
        @JsonProperty("deny_rules") List<DenyRule> denyRules,
        @JsonProperty("validate") ValidateConfig validate,
        @JsonProperty("rate_limit") RateLimitConfig rateLimit,
        @JsonProperty("detect_attacks") DetectAttacksConfig detectAttacks,
        @JsonProperty("redact") RedactConfig redact,
        @JsonProperty("audit") AuditConfig audit) {

    public Policy {
        if (policyId == null || policyId.isBlank()) {
            throw new PolicyConfigurationException("policy_id is required");
        }
        if (version == null || version.isBlank()) {
            throw new PolicyConfigurationException("version is required for policy " + policyId);
        }
        defaultEffect = defaultEffect != null ? defaultEffect : DefaultEffect.DENY;
        allowRules = copyRules(allowRules, "allow_rules", policyId);
        denyRules = copyRules(denyRules, "deny_rules", policyId);
        validate = validate != null ? validate : ValidateConfig.DISABLED;
        rateLimit = rateLimit != null ? rateLimit : RateLimitConfig.DISABLED;
        detectAttacks = detectAttacks != null ? detectAttacks : DetectAttacksConfig.DISABLED;
        redact = redact != null ? redact : RedactConfig.DISABLED;
        audit = audit != null ? audit : AuditConfig.DEFAULT;
    }

    private static <T> List<T> copyRules(List<T> rules, String field, String policyId) {
        if (rules == null)
            return List.of();
        if (rules.stream().anyMatch(Objects::isNull)) {
            throw new PolicyConfigurationException(field + " contains an empty entry in policy " + policyId);
        }
        return List.copyOf(rules);
    }
}
