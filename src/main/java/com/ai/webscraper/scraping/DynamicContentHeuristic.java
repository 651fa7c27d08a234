package com.ai.webscraper.scraping;

import com.ai.webscraper.exception.ScraperException;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * 정적 수집 오류가 동적 콘텐츠(SPA 등) 때문일 가능성이 있는지 판단.
 * 오류 메시지/컨텍스트에 토큰이 포함되면 true.
 */
public class DynamicContentHeuristic implements Predicate<ScraperException> {

    public static final List<String> DEFAULT_TOKENS = List.of(
            "javascript", "react", "vue", "angular", "spa", "dynamic", "empty", "no content");

    private final List<String> tokens;

    public DynamicContentHeuristic(List<String> tokens) {
        this.tokens = tokens.stream()
                .filter(token -> token != null && !token.isBlank())
                .map(token -> token.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public static DynamicContentHeuristic defaults() {
        return new DynamicContentHeuristic(DEFAULT_TOKENS);
    }

    @Override
    public boolean test(ScraperException error) {
        String text = error.describe().toLowerCase(Locale.ROOT);
        return tokens.stream().anyMatch(text::contains);
    }

    public List<String> tokens() {
        return tokens;
    }
}
