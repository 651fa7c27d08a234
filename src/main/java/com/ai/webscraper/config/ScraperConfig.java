package com.ai.webscraper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "scraper")
public class ScraperConfig {

    /**
     * 네트워크/브라우저 작업 타임아웃 (초)
     */
    private int requestTimeoutSeconds = 30;

    /**
     * 기본 수집 방식 (true면 렌더링 우선)
     */
    private boolean preferRendered = false;

    /**
     * 수집 실패시 최대 재시도 횟수
     */
    private int maxRetries = 2;

    /**
     * 요청별 maxRetries 상한
     */
    private int maxRetriesLimit = 5;

    /**
     * 재시도 지수 백오프 기본 지연 (ms)
     */
    private long retryBaseDelayMs = 1000;

    private double retryMultiplier = 2.0;

    /**
     * 배치 동시 처리 수
     */
    private int batchConcurrency = 3;

    /**
     * 요청별 concurrency 상한 (배치 스레드 풀 크기)
     */
    private int maxBatchConcurrency = 16;

    private boolean continueOnError = true;

    private String userAgent = "AI-WebScraper/1.0 (+https://github.com/ai/ai-webscraper)";

    private boolean followRedirects = true;

    private int maxRedirects = 5;

    /**
     * 정적 요청에 추가할 헤더
     */
    private Map<String, String> extraHeaders = new LinkedHashMap<>();

    /**
     * AI 호출 전 HTML 정리 (script/style 제거) 여부
     */
    private boolean preprocessHtml = true;

    /**
     * 정적 수집 오류 메시지에 포함되면 렌더링 수집으로 폴백하는 토큰
     */
    private List<String> fallbackTokens = new ArrayList<>(List.of(
            "javascript", "react", "vue", "angular", "spa", "dynamic", "empty", "no content"));

    private Browser browser = new Browser();

    private Cache cache = new Cache();

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    @Data
    public static class Browser {
        private boolean headless = true;
        private int viewportWidth = 1366;
        private int viewportHeight = 768;
        private String userAgent =
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

        /**
         * 이미지 로딩 차단
         */
        private boolean disableImages = false;

        /**
         * 이 시간 동안 리소스 수가 변하지 않으면 네트워크 유휴로 판단 (ms)
         */
        private long networkIdleMs = 500;

        /**
         * waitForSelector/waitForFunction 이후 추가 대기 (ms)
         */
        private long settleDelayMs = 2000;

        private boolean scrollToBottom = true;

        private List<String> extraArguments = new ArrayList<>();
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private int maxEntries = 1000;

        /**
         * 비어 있으면 메모리 전용
         */
        private String filePath;
    }
}
