package com.ai.webscraper.util;

import com.ai.webscraper.exception.SchemaValidationException;
import com.ai.webscraper.model.FieldType;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 필드 스키마 검증 및 정규화
 */
public final class SchemaValidator {

    private SchemaValidator() {
    }

    /**
     * 스키마 검증
     *
     * @param schema 필드명 → 타입 토큰
     * @throws SchemaValidationException 비어 있거나 지원하지 않는 타입이 있는 경우
     */
    public static void validate(Map<String, String> schema) {
        if (schema == null || schema.isEmpty()) {
            throw new SchemaValidationException("Schema cannot be empty");
        }

        for (Map.Entry<String, String> entry : schema.entrySet()) {
            String fieldName = entry.getKey();
            String fieldType = entry.getValue();

            if (fieldName == null || fieldName.isBlank()) {
                throw new SchemaValidationException("Schema field names cannot be empty");
            }
            if (fieldType == null || fieldType.isBlank()) {
                throw new SchemaValidationException(
                        "Schema field type cannot be empty for field \"" + fieldName + "\"");
            }
            if (!FieldType.isSupported(fieldType)) {
                throw new SchemaValidationException(String.format(
                        "Unsupported schema type \"%s\" for field \"%s\". Supported types: %s, array<T>",
                        fieldType, fieldName, String.join(", ", FieldType.supportedTokens())));
            }
        }
    }

    /**
     * 필드명은 trim만, 타입 토큰은 trim + 소문자 변환. 입력 순서 유지.
     */
    public static Map<String, String> normalize(Map<String, String> schema) {
        Map<String, String> normalized = new LinkedHashMap<>();
        schema.forEach((name, type) -> normalized.put(
                name == null ? null : name.trim(),
                type == null ? null : type.trim().toLowerCase(Locale.ROOT)));
        return normalized;
    }

    public static Map<String, String> validateAndNormalize(Map<String, String> schema) {
        if (schema == null) {
            throw new SchemaValidationException("Schema cannot be empty");
        }
        Map<String, String> normalized = normalize(schema);
        validate(normalized);
        return normalized;
    }
}
