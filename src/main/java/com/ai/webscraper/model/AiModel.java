package com.ai.webscraper.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 제공자별 AI 모델 목록
 */
@Getter
@RequiredArgsConstructor
public enum AiModel {

    // OpenAI
    GPT_4O("gpt-4o", AiProvider.OPENAI),
    GPT_4O_MINI("gpt-4o-mini", AiProvider.OPENAI),
    GPT_4_TURBO("gpt-4-turbo", AiProvider.OPENAI),
    GPT_4("gpt-4", AiProvider.OPENAI),
    GPT_35_TURBO("gpt-3.5-turbo", AiProvider.OPENAI),

    // Gemini
    GEMINI_25_PRO("gemini-2.5-pro", AiProvider.GEMINI),
    GEMINI_25_FLASH("gemini-2.5-flash", AiProvider.GEMINI),
    GEMINI_20_FLASH("gemini-2.0-flash", AiProvider.GEMINI),
    GEMINI_25_FLASH_LITE("gemini-2.5-flash-lite", AiProvider.GEMINI),
    GEMINI_20_FLASH_LITE("gemini-2.0-flash-lite", AiProvider.GEMINI),
    GEMINI_PRO("gemini-pro", AiProvider.GEMINI);

    private final String modelName;
    private final AiProvider provider;

    public static Optional<AiModel> fromModelName(String modelName) {
        if (modelName == null) {
            return Optional.empty();
        }
        String trimmed = modelName.trim();
        return Arrays.stream(values())
                .filter(model -> model.modelName.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    public static List<AiModel> modelsFor(AiProvider provider) {
        return Arrays.stream(values())
                .filter(model -> model.provider == provider)
                .toList();
    }

    /**
     * 제공자의 기본 모델
     */
    public static AiModel defaultFor(AiProvider provider) {
        return fromModelName(provider.getDefaultModel())
                .orElseThrow(() -> new IllegalStateException("No default model for " + provider));
    }

    @Override
    public String toString() {
        return modelName;
    }
}
