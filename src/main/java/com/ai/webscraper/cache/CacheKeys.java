package com.ai.webscraper.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * (페이지 내용, 스키마, 제공자, 옵션)의 SHA-256 캐시 키.
 * 맵은 키 순서로 직렬화되므로 스키마 입력 순서와 무관하다.
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CacheKeys() {
    }

    public static String of(String pageContent, Map<String, String> schema, String providerId,
                            Map<String, ?> options) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("htmlContent", pageContent);
        input.put("schema", schema);
        input.put("provider", providerId);
        input.put("options", options == null ? Map.of() : options);

        try {
            byte[] canonical = CANONICAL.writeValueAsString(input).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key input is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 로그용 축약 키
     */
    public static String abbreviate(String key) {
        return key.length() > 16 ? key.substring(0, 16) + "..." : key;
    }
}
