package com.ai.webscraper.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 단일 URL 추출 결과.
 * success이면 data가, 실패면 error가 반드시 존재한다. 생성 후 변경되지 않는다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionResult(
        boolean success,
        Map<String, Object> data,
        String error,
        @JsonIgnore Duration elapsed,
        String providerId,
        String url,
        Instant timestamp
) {

    public ExtractionResult {
        if (success && data == null) {
            throw new IllegalArgumentException("Successful result must carry data");
        }
        if (!success && error == null) {
            throw new IllegalArgumentException("Failed result must carry an error");
        }
        data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
        timestamp = Objects.requireNonNullElseGet(timestamp, Instant::now);
    }

    public static ExtractionResult success(Map<String, Object> data, Duration elapsed,
                                           String providerId, String url) {
        return new ExtractionResult(true, data, null, elapsed, providerId, url, Instant.now());
    }

    public static ExtractionResult failure(String error, Duration elapsed, String providerId, String url) {
        return new ExtractionResult(false, null, error, elapsed, providerId, url, Instant.now());
    }

    public boolean hasData() {
        return success && !data.isEmpty();
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public int fieldCount() {
        return data == null ? 0 : data.size();
    }

    public List<String> fieldNames() {
        return data == null ? List.of() : List.copyOf(data.keySet());
    }

    public Object get(String field) {
        return data == null ? null : data.get(field);
    }

    /**
     * 소요 시간 등 부가 정보 (JSON 응답에 포함)
     */
    @JsonProperty("metadata")
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scrapingTimeMs", elapsed.toMillis());
        metadata.put("aiProvider", providerId);
        metadata.put("url", url);
        metadata.put("timestamp", timestamp.toString());
        metadata.put("fieldCount", fieldCount());
        metadata.put("fieldNames", fieldNames());
        metadata.put("hasData", hasData());
        metadata.put("hasError", hasError());
        return metadata;
    }

    @Override
    public String toString() {
        if (success) {
            return "ExtractionResult(success: true, fields: " + fieldCount() + ", time: " + elapsed.toMillis() + "ms, url: " + url + ")";
        }
        return "ExtractionResult(success: false, error: " + error + ", time: " + elapsed.toMillis() + "ms, url: " + url + ")";
    }
}
