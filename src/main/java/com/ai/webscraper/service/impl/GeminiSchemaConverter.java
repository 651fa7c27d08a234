package com.ai.webscraper.service.impl;

import com.ai.webscraper.model.FieldType;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 필드 스키마 → Gemini 응답 스키마 변환.
 * 모든 필드를 required로 지정해 값이 없어도 null로 키를 내보내게 한다.
 * object 타입은 하위 속성이 없는 객체 스키마를 거부하는 제공자가 있어 설명이 붙은 문자열로 내린다.
 */
@Slf4j
public final class GeminiSchemaConverter {

    public static final String SCHEMA_NAME = "extraction";
    static final String DATE_DESCRIPTION = "Date in ISO 8601 format";
    static final String URL_DESCRIPTION = "Valid URL";
    static final String EMAIL_DESCRIPTION = "Valid email address";
    static final String OBJECT_DESCRIPTION = "Complex object data as JSON string or structured text";

    private GeminiSchemaConverter() {
    }

    public static JsonSchema toJsonSchema(Map<String, String> schema) {
        JsonObjectSchema.Builder root = JsonObjectSchema.builder();
        List<String> required = new ArrayList<>();

        schema.forEach((field, type) -> {
            String name = field.trim();
            root.addProperty(name, elementFor(type));
            required.add(name);
        });

        return JsonSchema.builder()
                .name(SCHEMA_NAME)
                .rootElement(root.required(required).build())
                .build();
    }

    static JsonSchemaElement elementFor(String rawType) {
        String type = rawType.trim().toLowerCase(Locale.ROOT);

        if (FieldType.isArrayOf(type)) {
            return JsonArraySchema.builder()
                    .items(elementFor(FieldType.itemToken(type)))
                    .build();
        }

        return switch (type) {
            case "array", "list" -> JsonArraySchema.builder()
                    .items(JsonStringSchema.builder().build())
                    .build();
            case "string", "text" -> JsonStringSchema.builder().build();
            case "number", "float", "double" -> JsonNumberSchema.builder().build();
            case "integer", "int" -> JsonIntegerSchema.builder().build();
            case "boolean", "bool" -> JsonBooleanSchema.builder().build();
            case "date", "datetime" -> JsonStringSchema.builder().description(DATE_DESCRIPTION).build();
            case "url" -> JsonStringSchema.builder().description(URL_DESCRIPTION).build();
            case "email" -> JsonStringSchema.builder().description(EMAIL_DESCRIPTION).build();
            case "object" -> JsonStringSchema.builder().description(OBJECT_DESCRIPTION).build();
            default -> {
                log.warn("알 수 없는 필드 타입: {} (string으로 처리)", type);
                yield JsonStringSchema.builder().build();
            }
        };
    }
}
