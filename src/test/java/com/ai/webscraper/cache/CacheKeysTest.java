package com.ai.webscraper.cache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    void keyIsSha256Hex() {
        String key = CacheKeys.of("<html/>", Map.of("title", "string"), "openai", Map.of("model", "gpt-4o"));

        assertThat(key).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void schemaOrderDoesNotChangeKey() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("title", "string");
        first.put("price", "number");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("price", "number");
        second.put("title", "string");

        assertThat(CacheKeys.of("<p/>", first, "openai", Map.of()))
                .isEqualTo(CacheKeys.of("<p/>", second, "openai", Map.of()));
    }

    @Test
    void anyInputChangeChangesKey() {
        Map<String, String> schema = Map.of("title", "string");
        String base = CacheKeys.of("<p>a</p>", schema, "openai", Map.of("model", "gpt-4o"));

        assertThat(CacheKeys.of("<p>b</p>", schema, "openai", Map.of("model", "gpt-4o"))).isNotEqualTo(base);
        assertThat(CacheKeys.of("<p>a</p>", schema, "gemini", Map.of("model", "gpt-4o"))).isNotEqualTo(base);
        assertThat(CacheKeys.of("<p>a</p>", schema, "openai", Map.of("model", "gpt-4"))).isNotEqualTo(base);
        assertThat(CacheKeys.of("<p>a</p>", Map.of("title", "text"), "openai", Map.of("model", "gpt-4o")))
                .isNotEqualTo(base);
    }

    @Test
    void abbreviatesLongKeys() {
        assertThat(CacheKeys.abbreviate("0123456789abcdef0123")).isEqualTo("0123456789abcdef...");
        assertThat(CacheKeys.abbreviate("short")).isEqualTo("short");
    }
}
