package com.toolgate.common.net;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies host references (bare hosts, host:port, URLs) as public or
 * internal without touching DNS.
 * <p>
 * Only IP literals and well-known internal names are recognized; a hostname
 * that merely resolves to a private address is reported as {@link HostClass#PUBLIC}.
 */
public final class HostClassifier {

    private HostClassifier() {
    }

    public enum HostClass {
        PUBLIC,
        LOOPBACK,
        LINK_LOCAL,
        ANY_LOCAL,
        PRIVATE,
        INTERNAL_NAME;

        public boolean isInternal() {
            return this != PUBLIC;
        }
    }

    private static final Set<String> INTERNAL_HOSTNAMES = Set.of(
            "localhost", "localhost.localdomain", "ip6-localhost", "ip6-loopback",
            "metadata", "metadata.google.internal", "instance-data", "instance-data.ec2.internal");

    private static final List<String> INTERNAL_SUFFIXES = List.of(
            ".localhost", ".internal", ".local");

    private static final List<String> PRIVATE_IPV6_PREFIXES = List.of(
            "fc", "fd");

    private static final Pattern IPV4_LITERAL = Pattern.compile(
            "^\\d{1,3}(\\.\\d{1,3}){3}$");

    private static final Pattern IPV6_LITERAL = Pattern.compile(
            "^[0-9a-f:.]+$");

    private static final Pattern SCHEME = Pattern.compile(
            "^[a-z][a-z0-9+.-]*://", Pattern.CASE_INSENSITIVE);

    /**
     * Classify a raw reference, which may be a URL, {@code host:port} or a
     * bare host.
     */
    public static HostClass classifyReference(String reference) {
        String host = extractHost(reference);
        return host == null ? HostClass.PUBLIC : classifyHost(host);
    }

    /**
     * Classify a single host name or IP literal.
     */
    public static HostClass classifyHost(String hostname) {
        String normalized = normalizeHostname(hostname);
        if (normalized.isEmpty()) {
            return HostClass.PUBLIC;
        }
        if (INTERNAL_HOSTNAMES.contains(normalized)) {
            return normalized.startsWith("localhost") || normalized.startsWith("ip6-")
                    ? HostClass.LOOPBACK
                    : HostClass.INTERNAL_NAME;
        }
        for (String suffix : INTERNAL_SUFFIXES) {
            if (normalized.endsWith(suffix)) {
                return HostClass.INTERNAL_NAME;
            }
        }
        if (isIpLiteral(normalized)) {
            return classifyAddress(normalized);
        }
        return HostClass.PUBLIC;
    }

    /**
     * Pull the host portion out of a URL, {@code host:port} or bare host
     * string. Returns {@code null} for blank input.
     */
    public static String extractHost(String reference) {
        if (reference == null) {
            return null;
        }
        String trimmed = reference.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (SCHEME.matcher(trimmed).find()) {
            try {
                String host = URI.create(trimmed).getHost();
                if (host != null) {
                    return normalizeHostname(host);
                }
            } catch (IllegalArgumentException e) {
                // fall through to manual parsing
            }
            trimmed = SCHEME.matcher(trimmed).replaceFirst("");
        }
        int slash = indexOfAny(trimmed, '/', '?', '#');
        String authority = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            return close > 0 ? normalizeHostname(authority.substring(0, close + 1)) : null;
        }
        int colon = authority.indexOf(':');
        if (colon >= 0 && authority.indexOf(':', colon + 1) < 0) {
            authority = authority.substring(0, colon);
        }
        return normalizeHostname(authority);
    }

    static String normalizeHostname(String hostname) {
        if (hostname == null)
            return "";
        String h = hostname.trim().toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }
        if (h.endsWith(".")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private static boolean isIpLiteral(String host) {
        if (IPV4_LITERAL.matcher(host).matches()) {
            for (String part : host.split("\\.")) {
                if (Integer.parseInt(part) > 255) {
                    return false;
                }
            }
            return true;
        }
        return host.indexOf(':') >= 0 && IPV6_LITERAL.matcher(host).matches();
    }

    private static HostClass classifyAddress(String literal) {
        InetAddress address;
        try {
            // literal input only, so no lookup is performed
            address = InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            return HostClass.PUBLIC;
        }
        if (address.isLoopbackAddress())
            return HostClass.LOOPBACK;
        if (address.isAnyLocalAddress())
            return HostClass.ANY_LOCAL;
        if (address.isLinkLocalAddress())
            return HostClass.LINK_LOCAL;
        if (address.isSiteLocalAddress() || isPrivateIpv6(literal))
            return HostClass.PRIVATE;
        return HostClass.PUBLIC;
    }

    private static boolean isPrivateIpv6(String address) {
        if (address.indexOf(':') < 0)
            return false;
        return PRIVATE_IPV6_PREFIXES.stream().anyMatch(address::startsWith);
    }

    private static int indexOfAny(String s, char... chars) {
        int best = -1;
        for (char c : chars) {
            int idx = s.indexOf(c);
            if (idx >= 0 && (best < 0 || idx < best)) {
                best = idx;
            }
        }
        return best;
    }
}
