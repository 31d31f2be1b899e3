package com.toolgate.policy;

import com.toolgate.policy.model.Constraint;
import com.toolgate.policy.model.ConstraintType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Checks argument values against {@link Constraint}s.
 * <p>
 * Checks run in a fixed order (required, type, pattern, enum, range) and the
 * first violation is reported.
 */
public final class ConstraintMatcher {

    private ConstraintMatcher() {
    }

    /**
     * Result of a single check.
     */
    public record MatchOutcome(boolean ok, String reason) {

        private static final MatchOutcome OK = new MatchOutcome(true, null);

        public static MatchOutcome pass() {
            return OK;
        }

        public static MatchOutcome fail(String reason) {
            return new MatchOutcome(false, reason);
        }
    }

    /**
     * Check one argument.
     *
     * @param name       argument name, used in failure reasons
     * @param present    whether the argument key is present at all
     * @param value      the argument value; a present {@code null} is a type mismatch
     * @param constraint the constraint to apply
     */
    public static MatchOutcome match(String name, boolean present, Object value, Constraint constraint) {
        if (!present) {
            return constraint.isRequired()
                    ? MatchOutcome.fail("missing required argument: " + name)
                    : MatchOutcome.pass();
        }
        ConstraintType type = constraint.getType();
        if (!type.accepts(value)) {
            return MatchOutcome.fail("type mismatch: argument '" + name + "' must be " + type.label());
        }
        if (constraint.getCompiledPattern() != null
                && !constraint.getCompiledPattern().matcher(value.toString()).matches()) {
            return MatchOutcome.fail("argument '" + name + "' does not match pattern");
        }
        if (constraint.getEnumValues() != null && !inEnum(value, constraint)) {
            return MatchOutcome.fail("argument '" + name + "' not in enum");
        }
        if (type.isNumeric()) {
            BigDecimal number = toBigDecimal((Number) value);
            if (constraint.getMin() != null && number.compareTo(BigDecimal.valueOf(constraint.getMin())) < 0) {
                return MatchOutcome.fail("argument '" + name + "' below minimum " + formatBound(constraint.getMin()));
            }
            if (constraint.getMax() != null && number.compareTo(BigDecimal.valueOf(constraint.getMax())) > 0) {
                return MatchOutcome.fail("argument '" + name + "' above maximum " + formatBound(constraint.getMax()));
            }
        }
        return MatchOutcome.pass();
    }

    /**
     * Check every declared constraint against {@code arguments} in declaration
     * order. Undeclared arguments are ignored here.
     */
    public static MatchOutcome matchAll(Map<String, Constraint> constraints, Map<String, Object> arguments) {
        for (var entry : constraints.entrySet()) {
            String name = entry.getKey();
            MatchOutcome outcome = match(name, arguments.containsKey(name), arguments.get(name), entry.getValue());
            if (!outcome.ok())
                return outcome;
        }
        return MatchOutcome.pass();
    }

    /**
     * Literal equality without coercion between kinds: strings equal strings,
     * booleans equal booleans, numbers compare by numeric value.
     */
    public static boolean literalEquals(Object expected, Object actual) {
        if (expected == null || actual == null)
            return expected == actual;
        if (expected instanceof Boolean || actual instanceof Boolean)
            return expected.equals(actual);
        if (expected instanceof Number a && actual instanceof Number b) {
            if (!isFinite(a) || !isFinite(b))
                return a.equals(b);
            return toBigDecimal(a).compareTo(toBigDecimal(b)) == 0;
        }
        if (expected instanceof Number || actual instanceof Number)
            return false;
        return expected.equals(actual);
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private static boolean inEnum(Object value, Constraint constraint) {
        for (Object candidate : constraint.getEnumValues()) {
            if (literalEquals(candidate, value))
                return true;
        }
        return false;
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double d)
            return Double.isFinite(d);
        if (n instanceof Float f)
            return Float.isFinite(f);
        return true;
    }

    static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd)
            return bd;
        if (n instanceof BigInteger bi)
            return new BigDecimal(bi);
        if (n instanceof Double || n instanceof Float)
            return BigDecimal.valueOf(n.doubleValue());
        return BigDecimal.valueOf(n.longValue());
    }

    private static String formatBound(double bound) {
        if (bound == Math.rint(bound) && Math.abs(bound) < 1e15)
            return Long.toString((long) bound);
        return Double.toString(bound);
    }
}
