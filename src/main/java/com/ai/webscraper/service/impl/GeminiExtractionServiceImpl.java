package com.ai.webscraper.service.impl;

import com.ai.webscraper.dto.AiExtraction;
import com.ai.webscraper.exception.OperationTimeoutException;
import com.ai.webscraper.exception.ParsingException;
import com.ai.webscraper.exception.ProviderException;
import com.ai.webscraper.exception.ScraperException;
import com.ai.webscraper.model.AiProvider;
import com.ai.webscraper.service.AiExtractionService;
import com.ai.webscraper.service.PromptBuilder;
import com.ai.webscraper.util.PartialJsonParser;
import com.ai.webscraper.util.ResponseNormalizer;
import com.ai.webscraper.util.TextUtils;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.googleai.GeminiHarmBlockThreshold;
import dev.langchain4j.model.googleai.GeminiHarmCategory;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Gemini 기반 추출 서비스.
 * 필드 스키마를 응답 스키마로 변환해 요청마다 전달하고, 응답 텍스트를 JSON으로 해석한다.
 */
@Slf4j
public class GeminiExtractionServiceImpl implements AiExtractionService {

    public static final String PROVIDER_NAME = "Gemini";
    private static final int MAX_CONTENT_LENGTH = 100000;

    private final String apiKey;
    private final String modelName;
    private final Duration timeout;
    private final Function<ResponseFormat, ChatLanguageModel> modelFactory;

    public GeminiExtractionServiceImpl(String apiKey, String modelName, Duration timeout,
                                       double temperature, int maxOutputTokens, Double topP, Integer topK) {
        this(apiKey, modelName, timeout, responseFormat -> GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .topP(topP)
                .topK(topK)
                .maxOutputTokens(maxOutputTokens)
                .timeout(timeout)
                .maxRetries(0)
                .responseFormat(responseFormat)
                .safetySettings(disabledSafetySettings())
                .build());
    }

    /**
     * @param modelFactory 응답 형식별 채팅 모델 생성 (테스트에서 교체)
     */
    public GeminiExtractionServiceImpl(String apiKey, String modelName, Duration timeout,
                                       Function<ResponseFormat, ChatLanguageModel> modelFactory) {
        this.apiKey = apiKey;
        this.modelName = modelName;
        this.timeout = timeout;
        this.modelFactory = modelFactory;
        log.info("Gemini 추출 서비스 생성 - Model: {}, Max Content: {}", modelName, MAX_CONTENT_LENGTH);
    }

    static Map<GeminiHarmCategory, GeminiHarmBlockThreshold> disabledSafetySettings() {
        Map<GeminiHarmCategory, GeminiHarmBlockThreshold> settings = new EnumMap<>(GeminiHarmCategory.class);
        settings.put(GeminiHarmCategory.HARM_CATEGORY_HARASSMENT, GeminiHarmBlockThreshold.BLOCK_NONE);
        settings.put(GeminiHarmCategory.HARM_CATEGORY_HATE_SPEECH, GeminiHarmBlockThreshold.BLOCK_NONE);
        settings.put(GeminiHarmCategory.HARM_CATEGORY_SEXUALLY_EXPLICIT, GeminiHarmBlockThreshold.BLOCK_NONE);
        settings.put(GeminiHarmCategory.HARM_CATEGORY_DANGEROUS_CONTENT, GeminiHarmBlockThreshold.BLOCK_NONE);
        return settings;
    }

    @Override
    public AiExtraction extract(String html, Map<String, String> schema, String customInstructions) {
        log.info("Gemini 추출 시작 - Model: {}, HTML 크기: {}", modelName, html.length());

        JsonSchema responseSchema = GeminiSchemaConverter.toJsonSchema(schema);
        ResponseFormat format = ResponseFormat.builder()
                .type(ResponseFormatType.JSON)
                .jsonSchema(responseSchema)
                .build();
        log.debug("응답 스키마 필드: {}", schema.keySet());

        String prompt = PromptBuilder.buildSchemaConstrainedPrompt(html, customInstructions, MAX_CONTENT_LENGTH);
        String raw = generate(format, prompt);

        if (raw == null || raw.isBlank()) {
            throw new ProviderException("Empty response from Gemini API", PROVIDER_NAME);
        }
        log.debug("Gemini 응답 미리보기: {}", TextUtils.abbreviate(raw, 500));

        Map<String, Object> parsed;
        try {
            parsed = PartialJsonParser.parseObject(raw);
        } catch (ParsingException e) {
            log.error("Gemini 응답 JSON 파싱 실패 - 응답 길이: {}", raw.length());
            throw new ParsingException("Failed to parse Gemini response as JSON", raw);
        }

        Map<String, Object> normalized = ResponseNormalizer.normalize(parsed, schema);
        log.info("Gemini 추출 완료 - 필드: {}", normalized.keySet());
        return new AiExtraction(normalized, raw.trim());
    }

    private String generate(ResponseFormat format, String prompt) {
        try {
            return modelFactory.apply(format).generate(prompt);
        } catch (ScraperException e) {
            throw e;
        } catch (RuntimeException e) {
            throw mapError(e);
        }
    }

    /**
     * SDK 예외를 메시지 내용으로 분류
     */
    ScraperException mapError(RuntimeException e) {
        if (isTimeout(e)) {
            return new OperationTimeoutException("Request timed out after " + timeout.toSeconds() + " seconds",
                    "Gemini generateContent", timeout);
        }

        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);

        if (lower.contains("api key")) {
            return new ProviderException("Invalid API key: " + message, PROVIDER_NAME, 401, e);
        }
        if (lower.contains("quota") || lower.contains("rate limit")) {
            return new ProviderException("Quota exceeded: " + message, PROVIDER_NAME, 429, e);
        }
        if (lower.contains("blocked") || lower.contains("safety")) {
            return new ProviderException("Content blocked by safety filters: " + message, PROVIDER_NAME, 400, e);
        }
        if (lower.contains("location") || lower.contains("region")) {
            return new ProviderException("Unsupported user location: " + message, PROVIDER_NAME, 403, e);
        }
        return new ProviderException("Gemini API error: " + message, PROVIDER_NAME, null, e);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    @Override
    public AiProvider getProvider() {
        return AiProvider.GEMINI;
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
        return key != null && key.startsWith("AI") && key.length() >= 10;
    }
}
