package com.ai.webscraper.service;

import com.ai.webscraper.util.TextUtils;

import java.util.Iterator;
import java.util.Map;

/**
 * AI 추출 프롬프트 생성
 */
public final class PromptBuilder {

    public static final String SYSTEM_PROMPT = """
            You are a professional web scraping assistant. Your task is to extract structured data from HTML content and return it as valid JSON.

            Guidelines:
            1. Extract only the requested data fields
            2. Return valid JSON that matches the provided schema
            3. If a field is not found, use null for the value
            4. For arrays, return empty arrays if no items are found
            5. Preserve data types as specified in the schema
            6. Do not include any explanatory text, only return the JSON
            """;

    private PromptBuilder() {
    }

    /**
     * 스키마 설명을 본문에 포함하는 사용자 프롬프트 (completion 방식 제공자용)
     */
    public static String buildExtractionPrompt(String html, Map<String, String> schema,
                                               String instructions, int maxLength) {
        StringBuilder prompt = new StringBuilder();
        if (instructions != null && !instructions.isBlank()) {
            prompt.append("Additional Instructions:\n").append(instructions).append("\n\n");
        }
        prompt.append("Schema to extract:\n").append(describeSchema(schema)).append('\n');
        prompt.append("HTML Content:\n").append(TextUtils.truncateAtBoundary(html, maxLength)).append("\n\n");
        prompt.append("Return only valid JSON matching the schema above.\n");
        return prompt.toString();
    }

    /**
     * 응답 스키마를 별도로 전달하는 제공자용 프롬프트. 스키마를 본문에 쓰지 않는다.
     */
    public static String buildSchemaConstrainedPrompt(String html, String instructions, int maxLength) {
        StringBuilder prompt = new StringBuilder("""
                You are a professional web scraping assistant. Extract structured data from the HTML and return ONLY valid JSON.

                Instructions:
                1. Only output the JSON object (no markdown, no prose).
                2. Use the response schema provided out-of-band (DO NOT restate it in text).
                3. Extract ALL fields defined in the schema - return the complete structure.
                4. Use real values from the HTML; never hallucinate.
                5. If a value is absent: output null (unquoted). Never use the string "null", "N/A" or placeholders.
                6. For arrays: list real items; if none, use []. Never include ["null"].
                7. Preserve data types (string/number/boolean/array) exactly.
                8. For object fields: extract structured content as a JSON string or formatted text.
                9. Dates: prefer ISO 8601 if present; partial dates allowed if that's all that's available.
                10. Do not invent URLs, emails or prices; use null if missing.
                11. Trim surrounding whitespace.
                12. Include ALL schema fields in the response, even if some are null.
                """);
        if (instructions != null && !instructions.isBlank()) {
            prompt.append("\nAdditional Instructions (follow but do NOT restate schema):\n")
                    .append(instructions).append('\n');
        }
        prompt.append("\nHTML CONTENT START\n")
                .append(TextUtils.truncateAtBoundary(html, maxLength))
                .append("\nHTML CONTENT END\n\n")
                .append("Return ONLY the complete JSON object with all schema fields now.\n");
        return prompt.toString();
    }

    /**
     * { "field": "type", ... } 형태의 스키마 설명
     */
    public static String describeSchema(Map<String, String> schema) {
        StringBuilder sb = new StringBuilder("{\n");
        Iterator<Map.Entry<String, String>> it = schema.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, String> entry = it.next();
            sb.append("  \"").append(entry.getKey()).append("\": \"").append(entry.getValue()).append('"');
            sb.append(it.hasNext() ? ",\n" : "\n");
        }
        return sb.append("}\n").toString();
    }
}
