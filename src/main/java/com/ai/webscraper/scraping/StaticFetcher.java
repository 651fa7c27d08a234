package com.ai.webscraper.scraping;

import com.ai.webscraper.config.ScraperConfig;
import com.ai.webscraper.dto.RenderOptions;
import com.ai.webscraper.exception.OperationTimeoutException;
import com.ai.webscraper.exception.ScrapeException;
import com.ai.webscraper.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 정적 HTTP GET 수집. 리다이렉트는 직접 따라가며 홉 수를 제한한다.
 */
@Slf4j
@Component
public class StaticFetcher implements ScrapeStrategy {

    private static final Pattern CHARSET = Pattern.compile("charset=([^;]+)", Pattern.CASE_INSENSITIVE);
    private static final int BODY_PREVIEW_LENGTH = 200;

    private final HttpClient client;
    private final Duration timeout;
    private final Map<String, String> headers;
    private final boolean followRedirects;
    private final int maxRedirects;

    @Autowired
    public StaticFetcher(ScraperConfig config) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .connectTimeout(config.requestTimeout())
                        .build(),
                config.requestTimeout(),
                defaultHeaders(config.getUserAgent(), config.getExtraHeaders()),
                config.isFollowRedirects(),
                config.getMaxRedirects());
    }

    public StaticFetcher(HttpClient client, Duration timeout, Map<String, String> headers,
                         boolean followRedirects, int maxRedirects) {
        this.client = client;
        this.timeout = timeout;
        this.headers = Map.copyOf(headers);
        this.followRedirects = followRedirects;
        this.maxRedirects = maxRedirects;
    }

    public static Map<String, String> defaultHeaders(String userAgent, Map<String, String> extra) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", userAgent);
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.9");
        headers.put("Upgrade-Insecure-Requests", "1");
        if (extra != null) {
            headers.putAll(extra);
        }
        return headers;
    }

    @Override
    public String name() {
        return "HTTP";
    }

    @Override
    public String fetch(String url, RenderOptions options) {
        URI current = toUri(url);
        int redirects = 0;

        while (true) {
            HttpResponse<byte[]> response = send(current, url);
            int status = response.statusCode();

            if (status >= 200 && status < 300) {
                return decode(response, url);
            }

            if (status >= 300 && status < 400) {
                Optional<String> location = response.headers().firstValue("location");
                if (!followRedirects || location.isEmpty()) {
                    throw new ScrapeException("Redirect not followed", url, status,
                            "Received redirect status " + status + " but redirect following is disabled");
                }
                if (redirects >= maxRedirects) {
                    throw new ScrapeException("Too many redirects", url, status,
                            "Exceeded maximum of " + maxRedirects + " redirects");
                }
                redirects++;
                current = current.resolve(location.get());
                log.debug("리다이렉트 {}/{}: {}", redirects, maxRedirects, current);
                continue;
            }

            String body = new String(response.body(), StandardCharsets.UTF_8);
            throw new ScrapeException("HTTP request failed with status " + status, url, status,
                    "Response body: " + TextUtils.abbreviate(body, BODY_PREVIEW_LENGTH));
        }
    }

    private URI toUri(String url) {
        try {
            return URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new ScrapeException("Invalid URL format", url, null, "Format error: " + e.getMessage(), e);
        }
    }

    private HttpResponse<byte[]> send(URI uri, String originalUrl) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).GET().timeout(timeout);
        headers.forEach(builder::header);

        CompletableFuture<HttpResponse<byte[]>> future =
                client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 요청은 중단하지 않고 버린다
            throw timeoutError(originalUrl);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeException("HTTP request interrupted", originalUrl, null, null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw timeoutError(originalUrl);
            }
            if (cause instanceof IOException) {
                throw new ScrapeException("Network connection failed", originalUrl, null,
                        "Socket error: " + cause.getMessage(), cause);
            }
            throw new ScrapeException("Unexpected error during HTTP request", originalUrl, null,
                    "Error: " + cause, cause);
        }
    }

    private OperationTimeoutException timeoutError(String url) {
        return new OperationTimeoutException("HTTP request timed out", "HTTP GET request to " + url, timeout);
    }

    private String decode(HttpResponse<byte[]> response, String url) {
        String contentType = response.headers().firstValue("content-type").orElse("");
        Charset charset = charsetOf(contentType);
        String body = new String(response.body(), charset);

        String lowerType = contentType.toLowerCase(Locale.ROOT);
        if (!contentType.isEmpty()
                && !lowerType.contains("html")
                && !lowerType.contains("xml")
                && !lowerType.contains("text/plain")
                && !looksLikeHtml(body)) {
            throw new ScrapeException("Content type is not HTML or XML", url, response.statusCode(),
                    "Content-Type: " + contentType);
        }

        if (body.isBlank()) {
            throw new ScrapeException("Empty response body", url, response.statusCode(),
                    "Server returned no content");
        }
        log.debug("HTTP 수집 완료: {} ({} chars, {})", url, body.length(), charset);
        return body;
    }

    /**
     * 선언된 charset, 알 수 없으면 UTF-8 (잘못된 바이트는 대체 문자로)
     */
    static Charset charsetOf(String contentType) {
        Matcher matcher = CHARSET.matcher(contentType);
        if (matcher.find()) {
            String name = matcher.group(1).trim().replace("\"", "");
            try {
                return Charset.forName(name);
            } catch (IllegalArgumentException e) {
                log.debug("알 수 없는 charset '{}', UTF-8 사용", name);
            }
        }
        return StandardCharsets.UTF_8;
    }

    static boolean looksLikeHtml(String content) {
        String trimmed = content.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith("<!doctype html")
                || trimmed.startsWith("<html")
                || trimmed.contains("<body")
                || trimmed.contains("<head")
                || trimmed.contains("<title");
    }
}
