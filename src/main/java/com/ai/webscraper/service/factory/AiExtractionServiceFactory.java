package com.ai.webscraper.service.factory;

import com.ai.webscraper.config.AiModelConfig;
import com.ai.webscraper.exception.ProviderException;
import com.ai.webscraper.model.AiModel;
import com.ai.webscraper.model.AiProvider;
import com.ai.webscraper.service.AiExtractionService;
import com.ai.webscraper.service.impl.GeminiExtractionServiceImpl;
import com.ai.webscraper.service.impl.OpenAiExtractionServiceImpl;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * AI 추출 서비스 팩토리
 * 모델/API 키에 맞는 제공자 서비스를 생성
 */
@Component
@Slf4j
public class AiExtractionServiceFactory {

    private final AiModelConfig aiModelConfig;

    public AiExtractionServiceFactory(AiModelConfig aiModelConfig) {
        this.aiModelConfig = aiModelConfig;
    }

    @PostConstruct
    public void init() {
        log.info("=== AiExtractionServiceFactory 초기화 ===");
        log.info("지원 제공자: {}, 설정된 제공자: {}, 모델: {}",
                getSupportedProviders(), aiModelConfig.getProvider(), resolveModel().getModelName());
    }

    /**
     * 설정(ai.*)에 지정된 기본 서비스 생성
     */
    public AiExtractionService createDefault() {
        AiModel model = resolveModel();
        return create(model, apiKeyFor(model.getProvider()));
    }

    /**
     * 설정의 제공자/모델 결정. 모델이 비어 있으면 제공자 기본 모델.
     */
    public AiModel resolveModel() {
        AiProvider provider = AiProvider.fromId(aiModelConfig.getProvider());
        String modelName = aiModelConfig.getModel();
        if (modelName == null || modelName.isBlank()) {
            return AiModel.defaultFor(provider);
        }

        AiModel model = AiModel.fromModelName(modelName)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported AI model: " + modelName));
        if (model.getProvider() != provider) {
            throw new IllegalArgumentException(String.format(
                    "Model %s belongs to %s, not %s", model.getModelName(), model.getProvider().getId(), provider.getId()));
        }
        return model;
    }

    private String apiKeyFor(AiProvider provider) {
        return switch (provider) {
            case OPENAI -> aiModelConfig.getOpenai().getApiKey();
            case GEMINI -> aiModelConfig.getGemini().getApiKey();
        };
    }

    /**
     * @throws ProviderException API 키가 비어 있는 경우
     */
    public AiExtractionService create(AiModel model, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException("API key cannot be empty", model.getProvider().getDisplayName());
        }

        Duration timeout = Duration.ofSeconds(aiModelConfig.getTimeoutSeconds());
        log.info("AI 추출 서비스 생성 - Provider: {}, Model: {}", model.getProvider().getDisplayName(), model.getModelName());

        return switch (model.getProvider()) {
            case OPENAI -> new OpenAiExtractionServiceImpl(
                    apiKey,
                    model.getModelName(),
                    aiModelConfig.getOpenai().getBaseUrl(),
                    timeout,
                    aiModelConfig.getTemperature(),
                    aiModelConfig.getMaxTokens(),
                    aiModelConfig.getTopP());
            case GEMINI -> new GeminiExtractionServiceImpl(
                    apiKey,
                    model.getModelName(),
                    timeout,
                    aiModelConfig.getTemperature(),
                    aiModelConfig.getMaxTokens(),
                    aiModelConfig.getTopP(),
                    aiModelConfig.getTopK());
        };
    }

    /**
     * API 키 형식까지 검사한 뒤 생성
     *
     * @throws ProviderException 키 형식이 제공자와 맞지 않는 경우
     */
    public AiExtractionService createWithValidation(AiModel model, String apiKey) {
        AiExtractionService service = create(model, apiKey);
        if (!service.validateApiKey()) {
            throw new ProviderException("Invalid API key format for " + model.getProvider().getDisplayName(),
                    service.getProviderName());
        }
        return service;
    }

    public List<AiProvider> getSupportedProviders() {
        return Arrays.asList(AiProvider.values());
    }

    public boolean isProviderSupported(AiProvider provider) {
        return provider != null && getSupportedProviders().contains(provider);
    }
}
