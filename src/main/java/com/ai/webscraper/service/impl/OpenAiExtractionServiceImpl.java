package com.ai.webscraper.service.impl;

import com.ai.webscraper.dto.AiExtraction;
import com.ai.webscraper.exception.OperationTimeoutException;
import com.ai.webscraper.exception.ProviderException;
import com.ai.webscraper.exception.ScraperException;
import com.ai.webscraper.model.AiProvider;
import com.ai.webscraper.service.AiExtractionService;
import com.ai.webscraper.service.PromptBuilder;
import com.ai.webscraper.util.PartialJsonParser;
import com.ai.webscraper.util.ResponseNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ai4j.openai4j.OpenAiHttpException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions 기반 추출 서비스 (JSON 모드)
 */
@Slf4j
public class OpenAiExtractionServiceImpl implements AiExtractionService {

    public static final String PROVIDER_NAME = "OpenAI";
    private static final int MAX_CONTENT_LENGTH = 50000;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String apiKey;
    private final String modelName;
    private final Duration timeout;
    private final ChatLanguageModel chatModel;

    public OpenAiExtractionServiceImpl(String apiKey, String modelName, String baseUrl, Duration timeout,
                                       double temperature, int maxTokens, Double topP) {
        this(apiKey, modelName, timeout, OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .topP(topP)
                .timeout(timeout)
                .maxRetries(0)
                .responseFormat("json_object")
                .build());
        log.info("OpenAI 추출 서비스 생성 - Model: {}, Base URL: {}", modelName, baseUrl);
    }

    public OpenAiExtractionServiceImpl(String apiKey, String modelName, Duration timeout, ChatLanguageModel chatModel) {
        this.apiKey = apiKey;
        this.modelName = modelName;
        this.timeout = timeout;
        this.chatModel = chatModel;
    }

    @Override
    public AiExtraction extract(String html, Map<String, String> schema, String customInstructions) {
        log.info("OpenAI 추출 시작 - Model: {}, HTML 크기: {}", modelName, html.length());

        List<ChatMessage> messages = List.of(
                SystemMessage.from(PromptBuilder.SYSTEM_PROMPT),
                UserMessage.from(PromptBuilder.buildExtractionPrompt(html, schema, customInstructions, MAX_CONTENT_LENGTH)));

        String content = generate(messages);
        Map<String, Object> parsed = PartialJsonParser.parseObject(content);
        Map<String, Object> normalized = ResponseNormalizer.normalize(parsed, schema);

        log.info("OpenAI 추출 완료 - 필드: {}", normalized.keySet());
        return new AiExtraction(normalized, content);
    }

    private String generate(List<ChatMessage> messages) {
        Response<AiMessage> response;
        try {
            response = chatModel.generate(messages);
        } catch (ScraperException e) {
            throw e;
        } catch (RuntimeException e) {
            throw mapError(e);
        }

        AiMessage message = response == null ? null : response.content();
        if (message == null) {
            throw new ProviderException("No message found in OpenAI response", PROVIDER_NAME);
        }
        String text = message.text();
        if (text == null || text.isBlank()) {
            throw new ProviderException("Empty content in OpenAI response", PROVIDER_NAME);
        }
        return text.trim();
    }

    /**
     * SDK 예외를 원인 체인에서 분류 (HTTP 상태, 타임아웃, 네트워크)
     */
    ScraperException mapError(RuntimeException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof OpenAiHttpException http) {
                return fromStatus(http.code(), http.getMessage(), e);
            }
            if (t instanceof InterruptedIOException) {
                return new OperationTimeoutException("Request timed out after " + timeout.toSeconds() + " seconds",
                        "OpenAI chat completion", timeout);
            }
            if (t instanceof IOException) {
                return new ProviderException("Network error: Unable to connect to OpenAI API", PROVIDER_NAME, null, e);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new ProviderException("OpenAI API error: " + message, PROVIDER_NAME, null, e);
    }

    ProviderException fromStatus(int status, String body, Throwable cause) {
        return switch (status) {
            case 401 -> new ProviderException("Authentication failed: Invalid API key", PROVIDER_NAME, 401, cause);
            case 403 -> new ProviderException("Access forbidden: Check your API key permissions", PROVIDER_NAME, 403, cause);
            case 429 -> new ProviderException("Rate limit exceeded: " + errorMessage(body, "Rate limit exceeded"),
                    PROVIDER_NAME, 429, cause);
            case 500, 502, 503, 504 -> new ProviderException("OpenAI service unavailable (" + status + ")",
                    PROVIDER_NAME, status, cause);
            default -> new ProviderException("OpenAI API error (" + status + "): " + errorMessage(body, "Unknown error"),
                    PROVIDER_NAME, status, cause);
        };
    }

    // 오류 본문 {"error":{"message":...}} 에서 메시지 추출, JSON이 아니면 기본값
    private String errorMessage(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : fallback;
        } catch (JsonProcessingException e) {
            log.debug("OpenAI 오류 본문이 JSON이 아님: {}", e.getOriginalMessage());
            return fallback;
        }
    }

    @Override
    public AiProvider getProvider() {
        return AiProvider.OPENAI;
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public int getMaxContentLength() {
        return MAX_CONTENT_LENGTH;
    }

    @Override
    public boolean validateApiKey() {
        return isValidKeyShape(apiKey);
    }

    public static boolean isValidKeyShape(String key) {
        return key != null && key.startsWith("sk-") && key.length() >= 20;
    }
}
