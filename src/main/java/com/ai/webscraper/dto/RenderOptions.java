package com.ai.webscraper.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 렌더링 수집 시 요청별 추가 옵션
 */
@Value
@Builder
@Jacksonized
public class RenderOptions {

    private static final RenderOptions NONE = RenderOptions.builder().build();

    /**
     * 이 CSS 선택자가 나타날 때까지 대기
     */
    String waitForSelector;

    /**
     * true를 반환할 때까지 대기할 JS 표현식
     */
    String waitForFunction;

    /**
     * 직렬화 전에 제거할 DOM 요소 선택자
     */
    @Singular
    List<String> removeSelectors;

    public static RenderOptions none() {
        return NONE;
    }
}
