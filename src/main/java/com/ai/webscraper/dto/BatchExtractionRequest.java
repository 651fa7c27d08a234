package com.ai.webscraper.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * 여러 URL 일괄 추출 요청. null 항목은 설정 기본값을 사용한다.
 */
@Value
@Builder
@Jacksonized
public class BatchExtractionRequest {

    @Singular
    List<String> urls;

    Map<String, String> fieldSchema;
    String customInstructions;
    Boolean preferRendered;
    Integer maxRetries;
    Integer concurrency;
    Boolean continueOnError;
    RenderOptions renderOptions;

    /**
     * URL 하나에 대한 단건 요청으로 변환
     */
    public ExtractionRequest toRequest(String url) {
        return ExtractionRequest.builder()
                .url(url)
                .fieldSchema(fieldSchema)
                .customInstructions(customInstructions)
                .preferRendered(preferRendered)
                .maxRetries(maxRetries)
                .renderOptions(renderOptions)
                .build();
    }
}
