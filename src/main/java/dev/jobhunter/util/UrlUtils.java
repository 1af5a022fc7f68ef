package dev.jobhunter.util;

import dev.jobhunter.error.AnalysisException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Require an absolute http(s) URL with a host.
     *
     * @param candidate Raw URL text
     * @param field     Name used in the error message
     * @return The trimmed URL
     * @throws AnalysisException ValidationFailed when the URL is empty or malformed
     */
    public static String requireHttpUrl(String candidate, String field) {
        if (candidate == null || candidate.isBlank()) {
            throw AnalysisException.validation(field + " is required");
        }
        String trimmed = candidate.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null || uri.getHost().isBlank()) {
            throw AnalysisException.validation(field + " is not a valid absolute URL: " + trimmed);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw AnalysisException.validation(field + " must use http or https: " + trimmed);
        }
        return trimmed;
    }

    private static URI safeUri(String url) {
        try {
            URI uri = new URI(url);
            return uri.getScheme() == null ? null : uri;
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
