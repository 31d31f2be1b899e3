package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolgate.policy.PolicyConfigurationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Acceptance rule for a single tool argument.
 * <p>
 * {@code pattern} applies to strings only and must match the whole value;
 * {@code min}/{@code max} apply to numeric types and are inclusive.
 * Invalid combinations fail at construction.
 */
@Getter
@ToString(exclude = "compiledPattern")
@EqualsAndHashCode(exclude = "compiledPattern")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Constraint {

    private final ConstraintType type;
    private final String pattern;
    @JsonIgnore
    private final Pattern compiledPattern;
    @JsonProperty("enum")
    private final List<Object> enumValues;
    private final Double min;
    private final Double max;
    private final boolean required;
    private final String description;

    @Builder
    @JsonCreator
    public Constraint(
            @JsonProperty("type") ConstraintType type,
            @JsonProperty("pattern") String pattern,
            @JsonProperty("enum") List<Object> enumValues,
            @JsonProperty("min") Double min,
            @JsonProperty("max") Double max,
            @JsonProperty("required") Boolean required,
            @JsonProperty("description") String description) {
        if (type == null) {
            throw new PolicyConfigurationException("Constraint type is required");
        }
        if (pattern != null && type != ConstraintType.STRING) {
            throw new PolicyConfigurationException("pattern only applies to string constraints, not " + type.label());
        }
        if ((min != null || max != null) && !type.isNumeric()) {
            throw new PolicyConfigurationException("min/max only apply to numeric constraints, not " + type.label());
        }
        if (min != null && max != null && min > max) {
            throw new PolicyConfigurationException("min " + min + " is greater than max " + max);
        }
        this.type = type;
        this.pattern = pattern;
        this.compiledPattern = compile(pattern);
        this.enumValues = enumValues != null
                ? Collections.unmodifiableList(new ArrayList<>(enumValues))
                : null;
        this.min = min;
        this.max = max;
        this.required = Boolean.TRUE.equals(required);
        this.description = description;
    }

    private static Pattern compile(String pattern) {
        if (pattern == null)
            return null;
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new PolicyConfigurationException("Invalid constraint pattern '" + pattern + "': "
                    + e.getDescription(), e);
        }
    }
}
