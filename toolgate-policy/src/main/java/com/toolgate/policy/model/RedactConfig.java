package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result scrubbing settings. Key matching against {@code denyKeys} is
 * case-insensitive; {@code maxStringLen <= 0} disables truncation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RedactConfig(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("deny_keys") List<String> denyKeys,
        @JsonProperty("pii_emails") boolean piiEmails,
        @JsonProperty("pii_phones") boolean piiPhones,
        @JsonProperty("secret_tokens") boolean secretTokens,
        @JsonProperty("max_string_len") int maxStringLen) {

    public static final List<String> DEFAULT_DENY_KEYS = List.of(
            "password", "token", "secret", "api_key", "authorization");

    public static final int DEFAULT_MAX_STRING_LEN = 2048;

    public static final RedactConfig DISABLED = new RedactConfig(
            false, DEFAULT_DENY_KEYS, true, false, false, DEFAULT_MAX_STRING_LEN);

    public RedactConfig {
        denyKeys = denyKeys != null ? List.copyOf(denyKeys) : DEFAULT_DENY_KEYS;
    }

    /**
     * Defaults with redaction switched on.
     */
    public static RedactConfig defaults() {
        return new RedactConfig(true, DEFAULT_DENY_KEYS, true, false, false, DEFAULT_MAX_STRING_LEN);
    }

    @JsonCreator
    public static RedactConfig fromJson(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("deny_keys") List<String> denyKeys,
            @JsonProperty("pii_emails") Boolean piiEmails,
            @JsonProperty("pii_phones") Boolean piiPhones,
            @JsonProperty("secret_tokens") Boolean secretTokens,
            @JsonProperty("max_string_len") Integer maxStringLen) {
        return new RedactConfig(
                Boolean.TRUE.equals(enabled),
                denyKeys,
                piiEmails == null || piiEmails,
                Boolean.TRUE.equals(piiPhones),
                Boolean.TRUE.equals(secretTokens),
                maxStringLen != null ? maxStringLen : DEFAULT_MAX_STRING_LEN);
    }
}
