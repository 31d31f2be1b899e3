package com.toolgate.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.toolgate.policy.PolicyConfigurationException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Closed set of argument types a {@link Constraint} can demand.
 */
public enum ConstraintType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ConstraintType fromLabel(String label) {
        if (label == null) {
            throw new PolicyConfigurationException("Constraint type is required");
        }
        return switch (label.trim().toLowerCase()) {
            case "string" -> STRING;
            case "integer", "int" -> INTEGER;
            case "number", "float" -> NUMBER;
            case "boolean", "bool" -> BOOLEAN;
            default -> throw new PolicyConfigurationException("Unsupported constraint type: " + label);
        };
    }

    /**
     * Whether {@code value} is representable as this type. {@code null} never is.
     */
    public boolean accepts(Object value) {
        if (value == null)
            return false;
        return switch (this) {
            case STRING -> value instanceof CharSequence;
            case BOOLEAN -> value instanceof Boolean;
            case INTEGER -> isIntegral(value);
            case NUMBER -> value instanceof Number n && isFinite(n);
        };
    }

    /**
     * Whether range bounds ({@code min}/{@code max}) make sense for this type.
     */
    public boolean isNumeric() {
        return this == INTEGER || this == NUMBER;
    }

    static boolean isIntegral(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float) {
            return Double.isFinite(n.doubleValue());
        }
        return true;
    }
}
