package io.newsdigest.ingestion.api.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reduces article links to a stable form so the same article syndicated by
 * several feeds yields the same key: scheme, host and path lowercased, default
 * port, fragment and tracking parameters dropped, remaining parameters sorted.
 */
public final class LinkCanonicalizer {

    private static final Set<String> TRACKING_PARAMETERS = Set.of(
            "fbclid", "gclid", "dclid", "msclkid", "yclid", "igshid",
            "mc_cid", "mc_eid", "_hsenc", "_hsmi", "mkt_tok",
            "ref", "ref_src", "cmpid", "ocid", "sr_share", "guccounter"
    );

    private LinkCanonicalizer() {
    }

    /**
     * @return the canonical link, or empty when the link is missing or not an absolute http(s) URL
     */
    public static Optional<String> canonicalize(String link) {
        if (link == null || link.isBlank()) return Optional.empty();

        URI uri;
        try {
            uri = new URI(link.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }

        String scheme = uri.getScheme();
        String host = uri.getHost();
        if (scheme == null || host == null) return Optional.empty();

        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return Optional.empty();

        StringBuilder canonical = new StringBuilder()
                .append(scheme)
                .append("://")
                .append(host.toLowerCase(Locale.ROOT));

        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            canonical.append(':').append(port);
        }

        canonical.append(canonicalPath(uri.getRawPath()));

        String query = canonicalQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            canonical.append('?').append(query);
        }

        return Optional.of(canonical.toString());
    }

    public static boolean isTrackingParameter(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.startsWith("utm_") || TRACKING_PARAMETERS.contains(lower);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
    }

    private static String canonicalPath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty() || rawPath.equals("/")) return "/";

        String path = rawPath.toLowerCase(Locale.ROOT);
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    private static String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";

        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;

            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            if (!isTrackingParameter(name)) {
                kept.add(pair);
            }
        }
        kept.sort(null);
        return String.join("&", kept);
    }
}
