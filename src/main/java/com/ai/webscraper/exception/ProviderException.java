package com.ai.webscraper.exception;

import lombok.Getter;

/**
 * AI 제공자 호출 실패. Orchestrator에서 자동 재시도하지 않는다.
 */
@Getter
public class ProviderException extends ScraperException {

    public enum Kind {
        UNAUTHORIZED,
        FORBIDDEN,
        RATE_LIMITED,
        SERVICE_UNAVAILABLE,
        BAD_REQUEST,
        GENERIC;

        public static Kind fromStatus(Integer status) {
            if (status == null) {
                return GENERIC;
            }
            return switch (status) {
                case 400 -> BAD_REQUEST;
                case 401 -> UNAUTHORIZED;
                case 403 -> FORBIDDEN;
                case 429 -> RATE_LIMITED;
                case 500, 502, 503, 504 -> SERVICE_UNAVAILABLE;
                default -> GENERIC;
            };
        }
    }

    private final String provider;
    private final Integer statusCode;
    private final Kind kind;

    public ProviderException(String message, String provider) {
        this(message, provider, null, null);
    }

    public ProviderException(String message, String provider, Integer statusCode) {
        this(message, provider, statusCode, null);
    }

    public ProviderException(String message, String provider, Integer statusCode, Throwable cause) {
        super(message, "Provider: " + provider + (statusCode != null ? " (Status: " + statusCode + ")" : ""), cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.kind = Kind.fromStatus(statusCode);
    }
}
