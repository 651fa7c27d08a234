package com.ai.webscraper.exception;

import lombok.Getter;

/**
 * AI 응답을 JSON으로 해석/복구하지 못함
 */
@Getter
public class ParsingException extends ScraperException {

    private static final int RAW_PREVIEW_LENGTH = 200;

    private final String rawData;

    public ParsingException(String message, String rawData) {
        super(message, "Raw data: " + truncate(rawData));
        this.rawData = rawData;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.length() > RAW_PREVIEW_LENGTH ? raw.substring(0, RAW_PREVIEW_LENGTH) + "..." : raw;
    }
}
