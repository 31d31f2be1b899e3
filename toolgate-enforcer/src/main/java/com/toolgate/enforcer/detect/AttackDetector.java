package com.toolgate.enforcer.detect;

import com.toolgate.common.net.HostClassifier;
import com.toolgate.enforcer.pipeline.CallContext;
import com.toolgate.enforcer.pipeline.GuardLayer;
import com.toolgate.policy.model.Decision;
import com.toolgate.policy.model.DetectAction;
import com.toolgate.policy.model.DetectAttacksConfig;
import com.toolgate.policy.model.EnforcementLayer;
import com.toolgate.policy.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based scan of selected argument fields for SQL injection, path
 * traversal and SSRF payloads.
 * <p>
 * A field is scanned wherever its name appears: at the top level of the
 * arguments and as a key of any nested map. Matching is heuristic and tuned
 * for low false-negative rates on common payloads; it does not parse SQL.
 */
@Slf4j
public class AttackDetector implements GuardLayer {

    public static final String REMEDIATION = "Remove suspicious patterns from arguments.";

    private static final int MAX_DEPTH = 32;

    // -----------------------------------------------------------------------
    // Patterns
    // -----------------------------------------------------------------------

    private static final List<Pattern> SQL_INJECTION = List.of(
            Pattern.compile("(?i)\\bunion\\b(\\s+all)?\\s+select\\b"),
            Pattern.compile("(?i)'\\s*(or|and)\\s+('?)(\\w+)\\2\\s*=\\s*\\2\\3\\b"),
            Pattern.compile("'\\s*(--|#|/\\*)"),
            Pattern.compile("(?i);\\s*(drop|delete|insert|update|alter|truncate|exec)\\b"),
            Pattern.compile("(?is)\\b(select|insert|update|delete|drop|union|where|from)\\b.*(--|/\\*)"));

    private static final List<Pattern> PATH_TRAVERSAL = List.of(
            Pattern.compile("\\.\\.[/\\\\]"),
            Pattern.compile("(?i)(%2e|%252e)(%2e|%252e|\\.)|\\.(%2e|%252e)|\\.\\.(%2f|%5c|%252f|%255c)"),
            Pattern.compile("\\u0000|%00"),
            Pattern.compile("(?i)(^|[\\s'\"=:(])(/etc/|/proc/|/sys/|/root/|/var/run/)"),
            Pattern.compile("(?i)\\b[a-z]:\\\\windows\\b"),
            Pattern.compile("(?i)\\bfile://"));

    /** Scheme plus authority only, so URLs nested in a path or query are found too. */
    private static final Pattern URL_AUTHORITY = Pattern.compile("(?i)\\b[a-z][a-z0-9+.-]*://[^\\s/?#'\"<>]+");

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    // -----------------------------------------------------------------------
    // GuardLayer
    // -----------------------------------------------------------------------

    @Override
    public EnforcementLayer layer() {
        return EnforcementLayer.DETECT_ATTACKS;
    }

    @Override
    public Decision check(CallContext context) {
        DetectAttacksConfig config = context.getPolicy().detectAttacks();
        if (!config.enabled()) {
            return Decision.allow("attack detection disabled", context.policyId(), EnforcementLayer.DETECT_ATTACKS);
        }
        if (config.onDetect() == DetectAction.DENY) {
            Optional<DetectionResult> hit = scan(context.getCall(), config);
            if (hit.isPresent()) {
                return Decision.deny(hit.get().describe(), context.policyId(), REMEDIATION,
                        EnforcementLayer.DETECT_ATTACKS);
            }
            return Decision.allow("no attack patterns", context.policyId(), EnforcementLayer.DETECT_ATTACKS);
        }
        List<DetectionResult> hits = scanAll(context.getCall(), config);
        for (DetectionResult hit : hits) {
            log.info("Flagged tool call {}: {}", context.getCall().toolName(), hit.describe());
            context.addFlag(hit.category().label());
        }
        return Decision.allow(hits.isEmpty() ? "no attack patterns" : "attack patterns flagged",
                context.policyId(), EnforcementLayer.DETECT_ATTACKS);
    }

    // -----------------------------------------------------------------------
    // Scanning
    // -----------------------------------------------------------------------

    /**
     * First detection in field order, then category order.
     */
    public Optional<DetectionResult> scan(ToolCall call, DetectAttacksConfig config) {
        if (!config.enabled())
            return Optional.empty();
        for (String field : config.fields()) {
            for (String text : fieldValues(call.arguments(), field)) {
                AttackCategory category = classify(text);
                if (category != null) {
                    return Optional.of(new DetectionResult(category, field));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Every field that produced a detection, one result per field.
     */
    public List<DetectionResult> scanAll(ToolCall call, DetectAttacksConfig config) {
        List<DetectionResult> results = new ArrayList<>();
        if (!config.enabled())
            return results;
        for (String field : config.fields()) {
            for (String text : fieldValues(call.arguments(), field)) {
                AttackCategory category = classify(text);
                if (category != null) {
                    results.add(new DetectionResult(category, field));
                    break;
                }
            }
        }
        return results;
    }

    /**
     * Category of the first pattern family that matches {@code text}, or
     * {@code null}.
     */
    public static AttackCategory classify(String text) {
        if (text == null || text.isEmpty())
            return null;
        if (anyFind(SQL_INJECTION, text))
            return AttackCategory.SQL_INJECTION;
        if (anyFind(PATH_TRAVERSAL, text))
            return AttackCategory.PATH_TRAVERSAL;
        if (targetsInternalHost(text))
            return AttackCategory.SSRF;
        return null;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private static boolean anyFind(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find())
                return true;
        }
        return false;
    }

    private static boolean targetsInternalHost(String text) {
        Matcher urls = URL_AUTHORITY.matcher(text);
        boolean sawUrl = false;
        while (urls.find()) {
            sawUrl = true;
            if (HostClassifier.classifyReference(urls.group()).isInternal())
                return true;
        }
        if (sawUrl)
            return false;
        String trimmed = text.trim();
        return !WHITESPACE.matcher(trimmed).find()
                && HostClassifier.classifyReference(trimmed).isInternal();
    }

    static List<String> fieldValues(Map<String, Object> arguments, String field) {
        List<String> out = new ArrayList<>();
        Object top = arguments.get(field);
        if (arguments.containsKey(field))
            collectStrings(top, out, 0);
        for (var entry : arguments.entrySet()) {
            collectNested(entry.getValue(), field, out, 1);
        }
        return out;
    }

    private static void collectNested(Object node, String field, List<String> out, int depth) {
        if (depth > MAX_DEPTH)
            return;
        if (node instanceof Map<?, ?> map) {
            for (var entry : map.entrySet()) {
                if (field.equals(entry.getKey()))
                    collectStrings(entry.getValue(), out, depth);
                collectNested(entry.getValue(), field, out, depth + 1);
            }
        } else if (node instanceof Collection<?> items) {
            for (Object item : items)
                collectNested(item, field, out, depth + 1);
        } else if (node instanceof Object[] items) {
            for (Object item : items)
                collectNested(item, field, out, depth + 1);
        }
    }

    private static void collectStrings(Object value, List<String> out, int depth) {
        if (value == null || depth > MAX_DEPTH)
            return;
        if (value instanceof Map<?, ?> map) {
            for (Object v : map.values())
                collectStrings(v, out, depth + 1);
        } else if (value instanceof Collection<?> items) {
            for (Object item : items)
                collectStrings(item, out, depth + 1);
        } else if (value instanceof Object[] items) {
            for (Object item : items)
                collectStrings(item, out, depth + 1);
        } else {
            out.add(String.valueOf(value));
        }
    }
}
