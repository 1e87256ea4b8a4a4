package com.hotlistdigest.core.signature;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class UrlNormalizer {
    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm",
            "spm",
            "fbclid",
            "gclid",
            "dclid",
            "msclkid",
            "yclid",
            "igshid",
            "mc_cid",
            "mc_eid",
            "_hsenc",
            "_hsmi",
            "ref_src",
            "guccounter",
            "guce_referrer",
            "guce_referrer_sig"
    );

    private UrlNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String trimmed = raw.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return stripFragment(trimmed);
        }
        String scheme = uri.getScheme();
        String host = uri.getHost();
        if (scheme == null || host == null) {
            return stripTrailingSlashes(stripFragment(trimmed));
        }

        StringBuilder normalized = new StringBuilder();
        normalized.append(scheme.toLowerCase(Locale.ROOT)).append("://");
        if (uri.getRawUserInfo() != null) {
            normalized.append(uri.getRawUserInfo()).append('@');
        }
        normalized.append(host.toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            normalized.append(':').append(uri.getPort());
        }
        normalized.append(stripTrailingSlashes(uri.getRawPath() == null ? "" : uri.getRawPath()));
        String query = filterQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            normalized.append('?').append(query);
        }
        return normalized.toString();
    }

    static boolean isTrackingParam(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        return TRACKING_PARAMS.contains(lowered) || lowered.startsWith("utm_");
    }

    private static String filterQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String token : rawQuery.split("&")) {
            if (token.isEmpty()) {
                continue;
            }
            int eq = token.indexOf('=');
            String name = eq >= 0 ? token.substring(0, eq) : token;
            if (!isTrackingParam(name)) {
                kept.add(token);
            }
        }
        return String.join("&", kept);
    }

    private static String stripFragment(String value) {
        int hash = value.indexOf('#');
        return hash >= 0 ? value.substring(0, hash) : value;
    }

    private static String stripTrailingSlashes(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
