package com.ai.webscraper.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AI 응답 후처리: "null" 문자열을 실제 null로 바꾸고, 스키마 필드가 모두 존재하도록 채운다.
 * 제공자와 무관하게 동일하게 적용된다.
 */
public final class ResponseNormalizer {

    private ResponseNormalizer() {
    }

    public static Map<String, Object> normalize(Map<String, ?> raw, Map<String, String> schema) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((key, value) -> cleaned.put(key, clean(value)));
        }
        for (String field : schema.keySet()) {
            if (!cleaned.containsKey(field)) {
                cleaned.put(field, null);
            }
        }
        return cleaned;
    }

    /**
     * 값 재귀 정리. 배열 안에서 null이 된 원소는 제거한다 (["null"] → []).
     */
    static Object clean(Object value) {
        if (value instanceof String text) {
            return "null".equalsIgnoreCase(text.trim()) ? null : text;
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                Object cleanedItem = clean(item);
                if (cleanedItem != null) {
                    result.add(cleanedItem);
                }
            }
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((key, item) -> result.put(String.valueOf(key), clean(item)));
            return result;
        }
        return value;
    }
}
