package com.ai.webscraper.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 캐시된 추출 결과
 *
 * @param key         입력 해시 (SHA-256 hex)
 * @param data        정규화된 추출 데이터
 * @param rawResponse 제공자 원본 응답 (진단용)
 * @param timestamp   저장 시각
 */
public record CacheEntry(String key, Map<String, Object> data, String rawResponse, Instant timestamp) {

    /**
     * data는 중첩 맵/리스트까지 복사한 읽기 전용 사본으로 보관한다 (null 값 허용)
     */
    public CacheEntry {
        data = immutableMap(data);
    }

    private static Map<String, Object> immutableMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((name, value) -> copy.put(String.valueOf(name), immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(immutableValue(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public boolean isValid(Duration ttl, Clock clock) {
        return Duration.between(timestamp, clock.instant()).compareTo(ttl) < 0;
    }

    Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("data", data);
        json.put("timestamp", timestamp.toString());
        json.put("rawResponse", rawResponse);
        json.put("inputHash", key);
        return json;
    }

    @SuppressWarnings("unchecked")
    static CacheEntry fromJson(String key, Map<String, Object> json) {
        Object data = json.get("data");
        Object timestamp = json.get("timestamp");
        if (!(data instanceof Map) || !(timestamp instanceof String)) {
            throw new IllegalArgumentException("Malformed cache entry");
        }
        Object raw = json.get("rawResponse");
        return new CacheEntry(key, (Map<String, Object>) data, raw == null ? "" : raw.toString(),
                Instant.parse((String) timestamp));
    }
}
