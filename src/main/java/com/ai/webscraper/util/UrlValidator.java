package com.ai.webscraper.util;

import com.ai.webscraper.exception.UrlValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * URL 형식 검증 (http/https + host)
 */
public final class UrlValidator {

    public static final List<String> SUPPORTED_SCHEMES = List.of("http", "https");

    private UrlValidator() {
    }

    public static void validate(String url) {
        if (url == null || url.isBlank()) {
            throw new UrlValidationException("URL cannot be empty", "");
        }

        String trimmed = url.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new UrlValidationException("Invalid URL format: " + e.getMessage(), trimmed);
        }

        String scheme = uri.getScheme();
        if (scheme == null || !SUPPORTED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            throw new UrlValidationException(String.format("Unsupported URL scheme \"%s\". Supported schemes: %s",
                    scheme == null ? "" : scheme, String.join(", ", SUPPORTED_SCHEMES)), trimmed);
        }

        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new UrlValidationException("URL must have a valid host", trimmed);
        }
    }

    public static boolean isValid(String url) {
        try {
            validate(url);
            return true;
        } catch (UrlValidationException e) {
            return false;
        }
    }

    /**
     * 스킴이 없으면 https:// 추가
     */
    public static String normalize(String url) {
        return normalize(url, "https");
    }

    public static String normalize(String url, String defaultScheme) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        if (trimmed.isEmpty() || trimmed.contains("://")) {
            return trimmed;
        }
        return defaultScheme + "://" + trimmed;
    }

    public static Optional<String> extractDomain(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getHost() != null && !uri.getHost().isEmpty()) {
                return Optional.of(uri.getHost());
            }
            // example.com 같은 스킴 없는 도메인
            if (uri.getScheme() == null && !trimmed.contains("/") && trimmed.contains(".")) {
                return Optional.ofNullable(new URI("http://" + trimmed).getHost());
            }
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
