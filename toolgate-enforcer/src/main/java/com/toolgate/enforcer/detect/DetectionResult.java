package com.toolgate.enforcer.detect;

/**
 * A positive detection: which category fired, in which argument.
 */
public record DetectionResult(AttackCategory category, String field) {

    public String describe() {
        return "potential " + category.label() + " detected in argument '" + field + "'";
    }
}
