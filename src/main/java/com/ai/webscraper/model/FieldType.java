package com.ai.webscraper.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 필드 스키마 타입 토큰.
 * {@code array<T>} 형태는 {@link #isSupported(String)}에서 재귀적으로 처리한다.
 */
public enum FieldType {

    STRING("string"),
    TEXT("text"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object"),
    DATE("date"),
    URL("url"),
    EMAIL("email");

    public static final String ARRAY_PREFIX = "array<";

    private final String token;

    FieldType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static List<String> supportedTokens() {
        return Arrays.stream(values()).map(FieldType::token).toList();
    }

    /**
     * 타입 토큰 해석. 지원하지 않는 토큰이면 empty.
     */
    public static Optional<FieldType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.token.equals(normalized))
                .findFirst();
    }

    public static boolean isArrayOf(String token) {
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith(ARRAY_PREFIX) && normalized.endsWith(">");
    }

    /**
     * {@code array<T>}에서 T 추출
     */
    public static String itemToken(String token) {
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return normalized.substring(ARRAY_PREFIX.length(), normalized.length() - 1).trim();
    }

    /**
     * 토큰이 지원 타입 집합에 속하는지 (array&lt;T&gt;는 T까지 재귀 확인)
     */
    public static boolean isSupported(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        if (isArrayOf(token)) {
            return isSupported(itemToken(token));
        }
        return fromToken(token).isPresent();
    }
}
