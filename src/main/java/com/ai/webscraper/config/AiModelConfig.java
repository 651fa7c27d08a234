package com.ai.webscraper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ai")
public class AiModelConfig {
    private String provider = "openai"; // openai | gemini
    private String model; // 비어 있으면 제공자 기본 모델
    private double temperature = 0.1;
    private int maxTokens = 1000;
    private Double topP;
    private Integer topK;
    private int timeoutSeconds = 30; // AI 응답 타임아웃 (초)

    private OpenAiConfig openai = new OpenAiConfig();
    private GeminiConfig gemini = new GeminiConfig();

    @Data
    public static class OpenAiConfig {
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
    }

    @Data
    public static class GeminiConfig {
        private String apiKey;
    }
}
