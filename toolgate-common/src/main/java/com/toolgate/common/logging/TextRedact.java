package com.toolgate.common.logging;

import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based masking of sensitive text: email addresses, phone numbers and
 * credential-looking tokens.
 */
public final class TextRedact {

    private TextRedact() {
    }

    // -----------------------------------------------------------------------
    // Placeholders
    // -----------------------------------------------------------------------

    public static final String EMAIL_PLACEHOLDER = "[REDACTED_EMAIL]";
    public static final String PHONE_PLACEHOLDER = "[REDACTED_PHONE]";
    public static final String PRIVATE_KEY_PLACEHOLDER = "[REDACTED_PRIVATE_KEY]";
    public static final String VALUE_PLACEHOLDER = "[REDACTED]";

    /** Secrets shorter than this are replaced outright instead of keeping a prefix. */
    private static final int MIN_MASKABLE_LENGTH = 16;
    private static final int VISIBLE_PREFIX = 6;

    // -----------------------------------------------------------------------
    // Patterns
    // -----------------------------------------------------------------------

    private static final Pattern EMAIL = Pattern.compile(
            "\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern PHONE = Pattern.compile(
            "(?<![\\w+])(?:\\+?\\d{1,3}[-.\\s]?)?(?:\\(\\d{3}\\)|\\d{3})[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");

    private static final Pattern PRIVATE_KEY_BLOCK = Pattern.compile(
            "-----BEGIN [A-Z ]*PRIVATE KEY-----[\\s\\S]+?-----END [A-Z ]*PRIVATE KEY-----");

    /**
     * A credential shape. {@code secretGroup} is the capture holding the
     * secret itself, 0 when the whole match is the secret.
     */
    private record SecretShape(Pattern pattern, int secretGroup) {
    }

    private static final List<SecretShape> SECRET_SHAPES = List.of(
            new SecretShape(Pattern.compile("(?i)\\bBearer\\s+([A-Za-z0-9._~+/=-]{8,})"), 1),
            new SecretShape(Pattern.compile("\\bsk-[A-Za-z0-9_-]{8,}"), 0),
            new SecretShape(Pattern.compile("\\b(?:ghp_[A-Za-z0-9]{20,}|github_pat_[A-Za-z0-9_]{20,})"), 0),
            new SecretShape(Pattern.compile("\\bxox[baprs]-[A-Za-z0-9-]{10,}"), 0),
            new SecretShape(Pattern.compile("\\bAIza[0-9A-Za-z_-]{20,}"), 0),
            new SecretShape(Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"), 0),
            new SecretShape(Pattern.compile("\\bnpm_[A-Za-z0-9]{10,}"), 0));

    // -----------------------------------------------------------------------
    // Public API
    // -----------------------------------------------------------------------

    /**
     * Replace every email address with {@link #EMAIL_PLACEHOLDER}.
     */
    public static String redactEmails(String text) {
        if (text == null || text.indexOf('@') < 0) {
            return text;
        }
        return EMAIL.matcher(text).replaceAll(Matcher.quoteReplacement(EMAIL_PLACEHOLDER));
    }

    /**
     * Replace phone-number-shaped digit runs with {@link #PHONE_PLACEHOLDER}.
     */
    public static String redactPhones(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return PHONE.matcher(text).replaceAll(Matcher.quoteReplacement(PHONE_PLACEHOLDER));
    }

    /**
     * Replace private key blocks with {@link #PRIVATE_KEY_PLACEHOLDER} and mask
     * API keys and bearer tokens down to a short prefix.
     */
    public static String redactSecretTokens(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = PRIVATE_KEY_BLOCK.matcher(text)
                .replaceAll(Matcher.quoteReplacement(PRIVATE_KEY_PLACEHOLDER));
        for (SecretShape shape : SECRET_SHAPES) {
            int group = shape.secretGroup();
            result = shape.pattern().matcher(result)
                    .replaceAll(m -> Matcher.quoteReplacement(maskWithin(m, group)));
        }
        return result;
    }

    /**
     * Keep the first characters of a secret so it stays recognizable in
     * results; short secrets are replaced entirely.
     */
    public static String maskSecret(String secret) {
        if (secret.length() < MIN_MASKABLE_LENGTH) {
            return VALUE_PLACEHOLDER;
        }
        return secret.substring(0, VISIBLE_PREFIX) + "…";
    }

    /**
     * Cut {@code text} to {@code maxLength} characters, appending an ellipsis.
     * A non-positive limit disables truncation.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "…";
    }

    private static String maskWithin(MatchResult match, int group) {
        String whole = match.group();
        int from = match.start(group) - match.start();
        int to = match.end(group) - match.start();
        return whole.substring(0, from) + maskSecret(match.group(group)) + whole.substring(to);
    }
}
