package com.ai.webscraper.service;

import com.ai.webscraper.dto.BatchExtractionRequest;
import com.ai.webscraper.dto.ExtractionResult;

import java.util.List;

public interface BatchExtractionService {

    /**
     * 여러 URL을 동시 처리 수 제한 하에 추출. 결과 순서는 입력 URL 순서와 같다.
     *
     * @throws com.ai.webscraper.exception.ValidationException URL 목록/스키마/동시 처리 수가 잘못된 경우
     * @throws com.ai.webscraper.exception.BatchException      continueOnError=false에서 항목이 실패한 경우
     */
    List<ExtractionResult> extractAll(BatchExtractionRequest request);
}
