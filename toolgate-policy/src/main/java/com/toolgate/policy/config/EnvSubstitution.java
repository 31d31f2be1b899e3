package com.toolgate.policy.config;

import com.toolgate.policy.PolicyConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Environment variable substitution for policy documents.
 * <p>
 * String values may reference {@code ${VAR}} or {@code ${VAR:-default}};
 * {@code $${VAR}} yields the literal text {@code ${VAR}}. Only upper-case
 * names are recognized, anything else is left untouched.
 */
public final class EnvSubstitution {

    private EnvSubstitution() {
    }

    /** Group 1: escape marker, 2: variable name, 3: default. */
    private static final Pattern REFERENCE = Pattern.compile(
            "(\\$?)\\$\\{([A-Z_][A-Z0-9_]*)(?::-([^}]*))?\\}");

    /**
     * Resolve references in every string value of a parsed document tree.
     * Maps and lists are copied; other values pass through.
     *
     * @throws PolicyConfigurationException if a referenced variable is unset
     *                                      or empty and has no default
     */
    public static Object resolve(Object tree, Map<String, String> env) {
        return resolveNode(tree, env, "");
    }

    static String substituteString(String value, Map<String, String> env, String policyPath) {
        if (value.indexOf('$') < 0) {
            return value;
        }
        return REFERENCE.matcher(value)
                .replaceAll(ref -> Matcher.quoteReplacement(replacementFor(ref, env, policyPath)));
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private static Object resolveNode(Object node, Map<String, String> env, String path) {
        if (node instanceof String text) {
            return substituteString(text, env, path);
        }
        if (node instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                resolved.put(key, resolveNode(v, env, path.isEmpty() ? key : path + "." + key));
            });
            return resolved;
        }
        if (node instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            int index = 0;
            for (Object item : list) {
                resolved.add(resolveNode(item, env, path + "[" + index++ + "]"));
            }
            return resolved;
        }
        return node;
    }

    private static String replacementFor(MatchResult ref, Map<String, String> env, String policyPath) {
        if (!ref.group(1).isEmpty()) {
            return ref.group().substring(1);
        }
        String name = ref.group(2);
        String value = env.get(name);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        if (ref.group(3) != null) {
            return ref.group(3);
        }
        throw new PolicyConfigurationException("Missing env var \"" + name + "\" referenced at policy path: "
                + (policyPath.isEmpty() ? "<root>" : policyPath));
    }
}
