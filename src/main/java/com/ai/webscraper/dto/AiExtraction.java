package com.ai.webscraper.dto;

import java.util.Map;

/**
 * AI 제공자 추출 결과 (정규화된 데이터 + 원본 응답 텍스트)
 */
public record AiExtraction(Map<String, Object> data, String rawResponse) {
}
