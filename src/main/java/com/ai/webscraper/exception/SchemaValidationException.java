package com.ai.webscraper.exception;

public class SchemaValidationException extends ValidationException {

    public SchemaValidationException(String message) {
        super(message);
    }
}
