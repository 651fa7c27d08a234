package com.ai.webscraper.service;

import com.ai.webscraper.dto.ExtractionRequest;
import com.ai.webscraper.dto.ExtractionResult;

public interface ExtractionService {

    /**
     * 단일 URL 추출: 검증 → 수집(재시도 + 폴백) → 캐시 조회 → AI 추출 → 캐시 저장
     *
     * @return 결과. 실패는 예외 대신 error 필드로 전달된다.
     * @throws com.ai.webscraper.exception.ValidationException URL이 비어 있거나 스키마가 비어 있는 경우
     */
    ExtractionResult extract(ExtractionRequest request);

    /**
     * 결과에 기록되는 제공자 식별자 (openai, gemini)
     */
    String getProviderId();

    /**
     * 제공자 표시명
     */
    String getProviderInfo();

    int getMaxContentLength();

    boolean isApiKeyValid();
}
