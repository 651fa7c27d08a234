package com.ai.webscraper.exception;

import lombok.Getter;

@Getter
public class UrlValidationException extends ValidationException {

    private final String url;

    public UrlValidationException(String message, String url) {
        super(message, "Invalid URL: " + url);
        this.url = url;
    }
}
