package com.ai.webscraper.controller;

import com.ai.webscraper.exception.BatchException;
import com.ai.webscraper.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException e) {
        log.warn("요청 검증 실패: {}", e.describe());
        return ResponseEntity.badRequest()
                .body(Map.of(
                        "success", false,
                        "message", e.describe(),
                        "error", "VALIDATION_ERROR"
                ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(Map.of(
                        "success", false,
                        "message", "Malformed request body",
                        "error", "INVALID_REQUEST"
                ));
    }

    // 일부 항목 실패로 배치 전체가 중단된 경우
    @ExceptionHandler(BatchException.class)
    public ResponseEntity<Map<String, Object>> handleBatch(BatchException e) {
        log.error("배치 추출 실패: {}", e.describe());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", e.getMessage());
        body.put("error", "BATCH_FAILED");
        body.put("successCount", e.getSuccessCount());
        body.put("totalCount", e.getTotalCount());
        return ResponseEntity.status(502).body(body);
    }
}
