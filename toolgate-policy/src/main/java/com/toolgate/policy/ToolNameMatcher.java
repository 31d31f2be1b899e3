package com.toolgate.policy;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Matches tool names against rule patterns. A pattern is an exact name, a
 * {@code *} wildcard, or a glob containing {@code *}. Names are trimmed and
 * compared case-insensitively.
 */
public final class ToolNameMatcher {

    /** Compiled pattern for matching tool names. */
    private sealed interface CompiledPattern permits AllPattern, ExactPattern, GlobPattern {
    }

    private record AllPattern() implements CompiledPattern {
    }

    private record ExactPattern(String value) implements CompiledPattern {
    }

    private record GlobPattern(Pattern value) implements CompiledPattern {
    }

    private final CompiledPattern compiled;

    private ToolNameMatcher(CompiledPattern compiled) {
        this.compiled = compiled;
    }

    public static ToolNameMatcher compile(String pattern) {
        String normalized = normalize(pattern);
        if ("*".equals(normalized))
            return new ToolNameMatcher(new AllPattern());
        if (!normalized.contains("*"))
            return new ToolNameMatcher(new ExactPattern(normalized));
        String escaped = Pattern.quote(normalized).replace("*", "\\E.*\\Q");
        return new ToolNameMatcher(new GlobPattern(Pattern.compile("^" + escaped + "$")));
    }

    /**
     * One-shot match of {@code toolName} against {@code pattern}.
     */
    public static boolean matches(String pattern, String toolName) {
        return compile(pattern).matches(toolName);
    }

    public boolean matches(String toolName) {
        String name = normalize(toolName);
        if (compiled instanceof AllPattern)
            return true;
        if (compiled instanceof ExactPattern e)
            return !name.isEmpty() && name.equals(e.value());
        if (compiled instanceof GlobPattern g)
            return g.value().matcher(name).matches();
        return false;
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
