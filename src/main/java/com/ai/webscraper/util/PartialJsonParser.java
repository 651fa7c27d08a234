package com.ai.webscraper.util;

import com.ai.webscraper.exception.ParsingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AI 응답 텍스트를 JSON 객체로 해석.
 * 바로 파싱되지 않으면 첫 '{'부터 마지막 '}'까지를 잘라 다시 시도한다.
 */
@Slf4j
public class PartialJsonParser {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final Pattern OBJECT_BLOCK = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

    private PartialJsonParser() {
    }

    /**
     * @throws ParsingException 복구할 수 없는 경우
     */
    public static Map<String, Object> parseObject(String response) {
        if (response == null || response.isBlank()) {
            throw new ParsingException("AI response is empty", response);
        }

        String cleaned = cleanJsonString(response);
        Optional<Map<String, Object>> direct = tryParse(cleaned);
        if (direct.isPresent()) {
            return direct.get();
        }

        log.debug("JSON 직접 파싱 실패, 객체 블록 추출 시도");
        Matcher matcher = OBJECT_BLOCK.matcher(cleaned);
        if (matcher.find()) {
            Optional<Map<String, Object>> salvaged = tryParse(matcher.group());
            if (salvaged.isPresent()) {
                return salvaged.get();
            }
        }

        throw new ParsingException("Failed to parse AI response as JSON", response);
    }

    /**
     * 코드 블록 표시(```json) 제거
     */
    static String cleanJsonString(String json) {
        return json.trim()
                .replaceFirst("^```(?:json)?\\s*", "")
                .replaceFirst("\\s*```$", "")
                .trim();
    }

    private static Optional<Map<String, Object>> tryParse(String json) {
        try {
            Map<String, Object> parsed = mapper.readValue(json, MAP_TYPE);
            return Optional.ofNullable(parsed);
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
