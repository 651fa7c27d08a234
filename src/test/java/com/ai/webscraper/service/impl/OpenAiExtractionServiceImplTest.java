package com.ai.webscraper.service.impl;

import com.ai.webscraper.dto.AiExtraction;
import com.ai.webscraper.exception.OperationTimeoutException;
import com.ai.webscraper.exception.ParsingException;
import com.ai.webscraper.exception.ProviderException;
import com.ai.webscraper.exception.ScraperException;
import dev.ai4j.openai4j.OpenAiHttpException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ChatMessageType;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAiExtractionServiceImplTest {

    private static final String API_KEY = "sk-test-0123456789abcdef";

    @Mock
    private ChatLanguageModel chatModel;

    private OpenAiExtractionServiceImpl service;
    private Map<String, String> schema;

    @BeforeEach
    void setUp() {
        service = new OpenAiExtractionServiceImpl(API_KEY, "gpt-4o-mini", Duration.ofSeconds(30), chatModel);
        schema = new LinkedHashMap<>();
        schema.put("title", "string");
        schema.put("price", "number");
    }

    private void reply(String content) {
        when(chatModel.generate(anyList())).thenReturn(Response.from(AiMessage.from(content)));
    }

    private void fail(RuntimeException error) {
        when(chatModel.generate(anyList())).thenThrow(error);
    }

    @Test
    @SuppressWarnings("unchecked")
    void extractsAndNormalizesJsonModeResponse() {
        reply("{\"title\":\"Book\",\"price\":12.5,\"tags\":[\"null\"]}");

        AiExtraction extraction = service.extract("<h1>Book</h1>", schema, "Prices in USD");

        assertThat(extraction.data()).containsEntry("title", "Book").containsEntry("price", 12.5);
        assertThat(extraction.data().get("tags")).isEqualTo(List.of());
        assertThat(extraction.rawResponse()).startsWith("{\"title\":\"Book\"");

        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(chatModel).generate(messages.capture());
        assertThat(messages.getValue()).extracting(ChatMessage::type)
                .containsExactly(ChatMessageType.SYSTEM, ChatMessageType.USER);
        assertThat(((UserMessage) messages.getValue().get(1)).singleText())
                .contains("Prices in USD", "\"price\": \"number\"", "<h1>Book</h1>");
    }

    @Test
    void missingFieldsAreNull() {
        reply("{\"title\":\"Book\"}");

        assertThat(service.extract("<p/>", schema, null).data()).containsOnlyKeys("title", "price");
    }

    @Test
    void httpStatusMapsToProviderErrorKind() {
        assertThat(kindFor(401, "{}")).isEqualTo(ProviderException.Kind.UNAUTHORIZED);
        assertThat(kindFor(403, "{}")).isEqualTo(ProviderException.Kind.FORBIDDEN);
        assertThat(kindFor(429, "{\"error\":{\"message\":\"slow down\"}}")).isEqualTo(ProviderException.Kind.RATE_LIMITED);
        assertThat(kindFor(503, "not json")).isEqualTo(ProviderException.Kind.SERVICE_UNAVAILABLE);
        assertThat(kindFor(418, "{}")).isEqualTo(ProviderException.Kind.GENERIC);
    }

    @Test
    void rateLimitMessageIncludesProviderDetail() {
        fail(new OpenAiHttpException(429, "{\"error\":{\"message\":\"slow down\"}}"));

        assertThatThrownBy(() -> service.extract("<p/>", schema, null))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Rate limit exceeded: slow down");
    }

    @Test
    void wrappedHttpErrorIsStillClassified() {
        fail(new RuntimeException(new OpenAiHttpException(500, "{\"error\":{\"message\":\"boom\"}}")));

        assertThatThrownBy(() -> service.extract("<p/>", schema, null))
                .isInstanceOf(ProviderException.class)
                .hasMessage("OpenAI service unavailable (500)")
                .satisfies(e -> assertThat(((ProviderException) e).getStatusCode()).isEqualTo(500));
    }

    @Test
    void socketTimeoutBecomesOperationTimeout() {
        fail(new RuntimeException(new SocketTimeoutException("timeout")));

        assertThatThrownBy(() -> service.extract("<p/>", schema, null))
                .isInstanceOf(OperationTimeoutException.class)
                .hasMessage("Request timed out after 30 seconds");
    }

    @Test
    void connectionFailureIsNetworkError() {
        fail(new UncheckedIOException(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> service.extract("<p/>", schema, null))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Network error: Unable to connect to OpenAI API");
    }

    @Test
    void otherSdkErrorsAreGenericProviderErrors() {
        fail(new IllegalStateException("unexpected"));

        assertThatThrownBy(() -> service.extract("<p/>", schema, null))
                .isInstanceOf(ProviderException.class)
                .hasMessage("OpenAI API error: unexpected")
                .satisfies(e -> assertThat(((ProviderException) e).getKind()).isEqualTo(ProviderException.Kind.GENERIC));
    }

    @Test
    void blankContentIsProviderError() {
        reply("  ");

        assertThatThrownBy(() -> service.extract("<p/>", schema, null))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Empty content in OpenAI response");
    }

    @Test
    void nonJsonContentIsParsingError() {
        reply("Sorry, I can't do that");

        assertThatThrownBy(() -> service.extract("<p/>", schema, null))
                .isInstanceOf(ParsingException.class);
    }

    @Test
    void sdkBackedServiceIsBuiltWithoutNetworkAccess() {
        OpenAiExtractionServiceImpl built = new OpenAiExtractionServiceImpl(API_KEY, "gpt-4o",
                "https://api.openai.com/v1", Duration.ofSeconds(5), 0.2, 500, 0.9);

        assertThat(built.getModelName()).isEqualTo("gpt-4o");
        assertThat(built.getProviderName()).isEqualTo("OpenAI");
    }

    @Test
    void keyShapeCheck() {
        assertThat(service.validateApiKey()).isTrue();
        assertThat(OpenAiExtractionServiceImpl.isValidKeyShape("sk-short")).isFalse();
        assertThat(OpenAiExtractionServiceImpl.isValidKeyShape("AIzaSy0123456789abcdef")).isFalse();
        assertThat(service.getMaxContentLength()).isEqualTo(50000);
        assertThat(service.getModelType()).isEqualTo("openai");
    }

    private ProviderException.Kind kindFor(int status, String body) {
        ScraperException mapped = service.mapError(new OpenAiHttpException(status, body));
        assertThat(mapped).isInstanceOf(ProviderException.class);
        return ((ProviderException) mapped).getKind();
    }
}
