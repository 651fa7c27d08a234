package com.ai.webscraper.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 단일 URL 추출 요청. 호출마다 생성되며 불변.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExtractionRequest {

    String url;

    /**
     * 필드명 → 타입 토큰 (string, number, array&lt;string&gt; ...)
     */
    Map<String, String> fieldSchema;

    String customInstructions;

    /**
     * null이면 설정의 기본 수집 방식을 따른다
     */
    Boolean preferRendered;

    /**
     * null이면 scraper.max-retries, 상한은 scraper.max-retries-limit
     */
    Integer maxRetries;

    RenderOptions renderOptions;

    public RenderOptions effectiveRenderOptions() {
        return renderOptions != null ? renderOptions : RenderOptions.none();
    }
}
