package com.ayende.backend.core.tenant;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts the tenant subdomain from a request host.
 *
 * <ul>
 *   <li>{@code simifood.ayendecrm.com} -> {@code simifood}</li>
 *   <li>{@code simifood.localhost:8000} -> {@code simifood}</li>
 *   <li>{@code simifood.127.0.0.1.nip.io} -> {@code simifood}</li>
 *   <li>{@code www.ayendecrm.com}, {@code ayendecrm.com}, {@code 10.0.0.4} -> none</li>
 * </ul>
 */
public class SubdomainParser {

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");
    private static final String LOCALHOST = "localhost";
    private static final String WWW = "www";

    private final Set<String> platformHosts;
    private final List<String> wildcardDomains;

    /**
     * @param platformHosts   hosts that serve the platform itself and never carry a tenant
     *                        (e.g. a hosting provider's app domain)
     * @param wildcardDomains DNS wildcard services used for local testing (nip.io, sslip.io)
     */
    public SubdomainParser(List<String> platformHosts, List<String> wildcardDomains) {
        this.platformHosts = platformHosts.stream()
                .map(SubdomainParser::normalize)
                .filter(h -> !h.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.wildcardDomains = wildcardDomains.stream()
                .map(SubdomainParser::normalize)
                .filter(h -> !h.isEmpty())
                .toList();
    }

    public Optional<String> extractSubdomain(String host) {
        String hostname = stripPort(normalize(host));
        if (hostname.isEmpty() || hostname.startsWith("[") || IPV4.matcher(hostname).matches()) {
            return Optional.empty();
        }
        if (platformHosts.contains(hostname)) {
            return Optional.empty();
        }

        String[] labels = hostname.split("\\.");
        String candidate = null;

        if (labels.length >= 2 && LOCALHOST.equals(labels[labels.length - 1])) {
            candidate = labels[0];
        } else {
            String wildcard = matchingWildcard(hostname);
            if (wildcard != null) {
                String prefix = hostname.substring(0, hostname.length() - wildcard.length() - 1);
                String first = prefix.split("\\.")[0];
                // 127.0.0.1.nip.io has no tenant label in front of the address
                if (!NUMERIC.matcher(first).matches()) {
                    candidate = first;
                }
            } else if (labels.length > 2) {
                candidate = labels[0];
            }
        }

        if (candidate == null || candidate.isEmpty() || WWW.equals(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    /**
     * A slug no request could ever resolve to: {@code www}, {@code localhost}, an all-digit label,
     * or the leading label of a platform host.
     */
    public boolean isReserved(String slug) {
        String label = normalize(slug);
        if (WWW.equals(label) || LOCALHOST.equals(label) || NUMERIC.matcher(label).matches()) {
            return true;
        }
        for (String host : platformHosts) {
            if (host.equals(label) || host.startsWith(label + ".")) {
                return true;
            }
        }
        return false;
    }

    private String matchingWildcard(String hostname) {
        for (String wildcard : wildcardDomains) {
            if (hostname.endsWith("." + wildcard)) {
                return wildcard;
            }
        }
        return null;
    }

    private static String stripPort(String host) {
        int colon = host.lastIndexOf(':');
        if (colon >= 0 && !host.startsWith("[")) {
            host = host.substring(0, colon);
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
