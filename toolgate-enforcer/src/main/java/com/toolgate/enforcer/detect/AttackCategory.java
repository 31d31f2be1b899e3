package com.toolgate.enforcer.detect;

/**
 * Heuristic attack families, in the order they are checked.
 */
public enum AttackCategory {
    SQL_INJECTION("sql_injection"),
    PATH_TRAVERSAL("path_traversal"),
    SSRF("ssrf");

    private final String label;

    AttackCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
