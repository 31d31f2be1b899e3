package com.toolgate.enforcer.redact;

import com.toolgate.common.json.JsonSupport;
import com.toolgate.common.logging.TextRedact;
import com.toolgate.policy.model.RedactConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Structure-preserving scrubber for tool results.
 * <p>
 * Map entries under a deny key are replaced wholesale; string leaves are
 * truncated and then pattern-masked. Maps keep their iteration order. Objects
 * that are not maps, collections, arrays or scalars are first converted to a
 * JSON tree.
 */
@Slf4j
public class ResultRedactor {

    private static final int MAX_DEPTH = 64;

    private final RedactConfig config;
    private final Set<String> denyKeys;

    public ResultRedactor(RedactConfig config) {
        this.config = config;
        Set<String> keys = new LinkedHashSet<>();
        for (String key : config.denyKeys()) {
            if (key != null)
                keys.add(key.toLowerCase(Locale.ROOT));
        }
        this.denyKeys = Set.copyOf(keys);
    }

    /**
     * Redactor that only masks the given keys, with default pattern settings.
     */
    public static ResultRedactor forKeys(Collection<String> denyKeys) {
        RedactConfig defaults = RedactConfig.defaults();
        return new ResultRedactor(new RedactConfig(true, List.copyOf(denyKeys), defaults.piiEmails(),
                defaults.piiPhones(), defaults.secretTokens(), defaults.maxStringLen()));
    }

    /**
     * Redacted copy of {@code value}; the input is never mutated. Returns the
     * input unchanged when redaction is disabled. A {@code char[]} is redacted
     * as text; other primitive arrays hold no text and pass through.
     */
    public Object redact(Object value) {
        if (!config.enabled())
            return value;
        return redactValue(value, 0);
    }

    public boolean isDenyKey(Object key) {
        return key != null && denyKeys.contains(String.valueOf(key).toLowerCase(Locale.ROOT));
    }

    public String redactString(String text) {
        String result = TextRedact.truncate(text, config.maxStringLen());
        if (config.piiEmails())
            result = TextRedact.redactEmails(result);
        if (config.piiPhones())
            result = TextRedact.redactPhones(result);
        if (config.secretTokens())
            result = TextRedact.redactSecretTokens(result);
        return result;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private Object redactValue(Object value, int depth) {
        if (value == null)
            return null;
        if (depth > MAX_DEPTH)
            return TextRedact.VALUE_PLACEHOLDER;
        if (value instanceof CharSequence text)
            return redactString(text.toString());
        if (value instanceof Number || value instanceof Boolean || value instanceof Character
                || value instanceof Enum<?>)
            return value;
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (var entry : map.entrySet()) {
                out.put(entry.getKey(), isDenyKey(entry.getKey())
                        ? TextRedact.VALUE_PLACEHOLDER
                        : redactValue(entry.getValue(), depth + 1));
            }
            return out;
        }
        if (value instanceof Set<?> set) {
            Set<Object> out = new LinkedHashSet<>();
            for (Object item : set)
                out.add(redactValue(item, depth + 1));
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items)
                out.add(redactValue(item, depth + 1));
            return out;
        }
        if (value instanceof Object[] items) {
            Object[] out = new Object[items.length];
            for (int i = 0; i < items.length; i++)
                out[i] = redactValue(items[i], depth + 1);
            return out;
        }
        if (value instanceof char[] chars)
            return redactString(new String(chars)).toCharArray();
        if (value.getClass().isArray())
            return value;
        return redactConverted(value, depth);
    }

    private Object redactConverted(Object value, int depth) {
        Object tree;
        try {
            tree = JsonSupport.mapper().convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            log.debug("Result of type {} not convertible, redacting its string form", value.getClass().getName());
            return redactString(String.valueOf(value));
        }
        if (tree == null || tree == value)
            return tree == null ? null : redactString(String.valueOf(value));
        return redactValue(tree, depth + 1);
    }
}
