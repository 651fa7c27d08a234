package com.ai.webscraper.controller;

import com.ai.webscraper.cache.ResponseCache;
import com.ai.webscraper.dto.BatchExtractionRequest;
import com.ai.webscraper.dto.ExtractionRequest;
import com.ai.webscraper.dto.ExtractionResult;
import com.ai.webscraper.service.BatchExtractionService;
import com.ai.webscraper.service.ExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/extract")
@RequiredArgsConstructor
@Slf4j
public class ExtractionController {

    private final ExtractionService extractionService;
    private final BatchExtractionService batchExtractionService;
    private final ResponseCache responseCache;

    // 단일 URL 추출. 추출 실패도 200 + success=false 로 응답
    @PostMapping
    public ResponseEntity<ExtractionResult> extract(@RequestBody ExtractionRequest request) {
        log.info("추출 요청: {}", request != null ? request.getUrl() : null);
        return ResponseEntity.ok(extractionService.extract(request));
    }

    // 여러 URL 일괄 추출
    @PostMapping("/batch")
    public ResponseEntity<List<ExtractionResult>> extractBatch(@RequestBody BatchExtractionRequest request) {
        log.info("배치 추출 요청: {}개 URL", request.getUrls().size());
        return ResponseEntity.ok(batchExtractionService.extractAll(request));
    }

    /**
     * 캐시 통계 및 현재 AI 제공자 정보
     */
    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> getCacheStats() {
        return ResponseEntity.ok(Map.of(
                "cache", responseCache.getStats(),
                "provider", extractionService.getProviderId(),
                "providerName", extractionService.getProviderInfo()
        ));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        responseCache.clear();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "캐시가 초기화되었습니다."
        ));
    }
}
