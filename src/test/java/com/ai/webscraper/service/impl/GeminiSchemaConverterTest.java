package com.ai.webscraper.service.impl;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiSchemaConverterTest {

    @Test
    void everyFieldBecomesRequiredProperty() {
        Map<String, String> schema = new LinkedHashMap<>();
        schema.put("title", "string");
        schema.put("price", "number");
        schema.put("inStock", "boolean");

        JsonSchema jsonSchema = GeminiSchemaConverter.toJsonSchema(schema);
        JsonObjectSchema root = (JsonObjectSchema) jsonSchema.rootElement();

        assertThat(jsonSchema.name()).isEqualTo(GeminiSchemaConverter.SCHEMA_NAME);
        assertThat(root.properties()).containsOnlyKeys("title", "price", "inStock");
        assertThat(root.required()).containsExactly("title", "price", "inStock");
        assertThat(root.properties().get("price")).isInstanceOf(JsonNumberSchema.class);
        assertThat(root.properties().get("inStock")).isInstanceOf(JsonBooleanSchema.class);
    }

    @Test
    void typedArraysNestRecursively() {
        JsonArraySchema tags = (JsonArraySchema) GeminiSchemaConverter.elementFor("array<integer>");
        JsonArraySchema matrix = (JsonArraySchema) GeminiSchemaConverter.elementFor("ARRAY<array<string>>");

        assertThat(tags.items()).isInstanceOf(JsonIntegerSchema.class);
        assertThat(matrix.items()).isInstanceOf(JsonArraySchema.class);
        assertThat(((JsonArraySchema) matrix.items()).items()).isInstanceOf(JsonStringSchema.class);
    }

    @Test
    void plainArrayHoldsStrings() {
        JsonArraySchema array = (JsonArraySchema) GeminiSchemaConverter.elementFor("array");

        assertThat(array.items()).isInstanceOf(JsonStringSchema.class);
    }

    @Test
    void formattedStringsCarryDescriptions() {
        assertThat(((JsonStringSchema) GeminiSchemaConverter.elementFor("date")).description())
                .isEqualTo(GeminiSchemaConverter.DATE_DESCRIPTION);
        assertThat(((JsonStringSchema) GeminiSchemaConverter.elementFor("url")).description())
                .isEqualTo(GeminiSchemaConverter.URL_DESCRIPTION);
        assertThat(((JsonStringSchema) GeminiSchemaConverter.elementFor("email")).description())
                .isEqualTo(GeminiSchemaConverter.EMAIL_DESCRIPTION);
        assertThat(((JsonStringSchema) GeminiSchemaConverter.elementFor("object")).description())
                .isEqualTo(GeminiSchemaConverter.OBJECT_DESCRIPTION);
    }
}
