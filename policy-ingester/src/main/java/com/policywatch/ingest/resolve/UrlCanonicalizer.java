package com.policywatch.ingest.resolve;

import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Produces the identity URL for a document: fragment removed, tracking parameters removed,
 * scheme and host lower-cased, default ports dropped. Everything else is kept verbatim so two
 * distinct documents never collapse into one id.
 */
public final class UrlCanonicalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "fbclid", "gclid", "dclid", "msclkid", "mc_cid", "mc_eid",
            "_ga", "_gl", "_hsenc", "_hsmi", "igshid", "ref_src", "cmpid");

    private UrlCanonicalizer() {
    }

    public static String canonicalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        String trimmed = url.trim();
        try {
            UriComponents parsed = UriComponentsBuilder.fromUriString(trimmed).build();
            if (parsed.getScheme() == null || parsed.getHost() == null) {
                return withoutFragment(trimmed);
            }

            String scheme = parsed.getScheme().toLowerCase(Locale.ROOT);
            int port = parsed.getPort();
            boolean defaultPort = port == -1
                    || ("http".equals(scheme) && port == 80)
                    || ("https".equals(scheme) && port == 443);

            MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
            parsed.getQueryParams().forEach((name, values) -> {
                if (!isTracking(name)) {
                    query.put(name, values);
                }
            });

            String path = parsed.getPath();
            return UriComponentsBuilder.newInstance()
                    .scheme(scheme)
                    .userInfo(parsed.getUserInfo())
                    .host(parsed.getHost().toLowerCase(Locale.ROOT))
                    .port(defaultPort ? -1 : port)
                    .path(path == null || path.isEmpty() ? "/" : path)
                    .queryParams(query)
                    .build()
                    .toUriString();
        } catch (IllegalArgumentException e) {
            // malformed authority, e.g. a non-numeric port
            return withoutFragment(trimmed);
        }
    }

    /**
     * Resolves {@code href} against {@code base} and canonicalizes. Returns null for hrefs that
     * cannot point at a document (mailto, javascript, bare fragments, unparseable).
     */
    public static String resolve(String base, String href) {
        if (href == null) {
            return null;
        }
        String h = href.trim();
        String lower = h.toLowerCase(Locale.ROOT);
        if (h.isEmpty() || h.startsWith("#") || lower.startsWith("mailto:")
                || lower.startsWith("javascript:") || lower.startsWith("tel:")) {
            return null;
        }
        try {
            URI resolved = base == null ? new URI(h) : new URI(base.trim()).resolve(h.replace(" ", "%20"));
            String scheme = resolved.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return canonicalize(resolved.toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    static boolean isTracking(String paramName) {
        String name = paramName.toLowerCase(Locale.ROOT);
        return name.startsWith("utm_") || TRACKING_PARAMS.contains(name);
    }

    private static String withoutFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }
}
