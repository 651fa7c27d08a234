package com.ai.webscraper.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Locale;

/**
 * 지원하는 AI 제공자
 */
@Getter
@RequiredArgsConstructor
public enum AiProvider {

    OPENAI("openai", "OpenAI GPT", "gpt-3.5-turbo", true),
    GEMINI("gemini", "Google Gemini", "gemini-pro", false);

    private final String id;
    private final String displayName;
    private final String defaultModel;
    private final boolean jsonModeSupported;

    /**
     * 설정 문자열(openai, gemini)로 제공자 조회
     */
    public static AiProvider fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("AI provider id cannot be empty");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(provider -> provider.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported AI provider: " + id));
    }
}
