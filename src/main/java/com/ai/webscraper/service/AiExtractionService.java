package com.ai.webscraper.service;

import com.ai.webscraper.dto.AiExtraction;
import com.ai.webscraper.model.AiProvider;

import java.util.Map;

public interface AiExtractionService {

    /**
     * HTML에서 스키마 필드 추출
     *
     * @param html               페이지 HTML
     * @param schema             정규화된 필드 스키마 (필드명 → 타입 토큰)
     * @param customInstructions 추가 지시사항 (없으면 null)
     * @return 정규화된 데이터와 원본 응답. 스키마의 모든 필드가 키로 존재한다.
     * @throws com.ai.webscraper.exception.ProviderException  제공자 호출 실패
     * @throws com.ai.webscraper.exception.ParsingException   응답을 JSON으로 해석할 수 없음
     */
    AiExtraction extract(String html, Map<String, String> schema, String customInstructions);

    AiProvider getProvider();

    /**
     * 현재 사용 중인 모델명 (gpt-4o-mini, gemini-2.5-flash 등)
     */
    String getModelName();

    /**
     * 제공자 표시명 (OpenAI, Gemini)
     */
    String getProviderName();

    /**
     * 프롬프트에 넣을 HTML 최대 길이
     */
    int getMaxContentLength();

    /**
     * API 키 형식 검사
     */
    boolean validateApiKey();

    /**
     * 캐시 키에 쓰는 제공자 식별자
     */
    default String getModelType() {
        return getProvider().getId();
    }
}
