package com.ai.webscraper.scraping;

import com.ai.webscraper.dto.RenderOptions;
import com.ai.webscraper.exception.RenderedScrapeException;
import com.ai.webscraper.exception.ScrapeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentFetcherTest {

    private static final String URL = "https://example.com";

    @Mock
    private ScrapeStrategy staticFetch;
    @Mock
    private ScrapeStrategy renderedFetch;

    private ContentFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new ContentFetcher(staticFetch, renderedFetch, DynamicContentHeuristic.defaults());
    }

    @Test
    void staticSuccessSkipsBrowser() {
        when(staticFetch.fetch(any(), any())).thenReturn("<html>static</html>");

        assertThat(fetcher.fetch(URL, false, false, RenderOptions.none())).isEqualTo("<html>static</html>");
        verify(renderedFetch, never()).fetch(any(), any());
    }

    @Test
    void staticErrorWithoutDynamicHintIsRethrownOnFirstAttempt() {
        ScrapeException notFound = new ScrapeException("HTTP request failed with status 404", URL, 404, null);
        when(staticFetch.fetch(any(), any())).thenThrow(notFound);

        assertThatThrownBy(() -> fetcher.fetch(URL, false, false, RenderOptions.none())).isSameAs(notFound);
        verify(renderedFetch, never()).fetch(any(), any());
    }

    @Test
    void dynamicHintFallsBackToRendered() {
        when(staticFetch.fetch(any(), any()))
                .thenThrow(new ScrapeException("Empty response body", URL, 200, "Server returned no content"));
        when(renderedFetch.fetch(any(), any())).thenReturn("<html>rendered</html>");

        assertThat(fetcher.fetch(URL, false, false, RenderOptions.none())).isEqualTo("<html>rendered</html>");
    }

    @Test
    void retryAttemptAlwaysFallsBackToRendered() {
        when(staticFetch.fetch(any(), any())).thenThrow(new ScrapeException("HTTP request failed with status 500", URL));
        when(renderedFetch.fetch(any(), any())).thenReturn("<html>rendered</html>");

        assertThat(fetcher.fetch(URL, false, true, RenderOptions.none())).isEqualTo("<html>rendered</html>");
    }

    @Test
    void bothFailingInStaticFirstOrderCombinesErrors() {
        when(staticFetch.fetch(any(), any())).thenThrow(new ScrapeException("HTTP down", URL));
        when(renderedFetch.fetch(any(), any())).thenThrow(new RenderedScrapeException("JS down", URL, null));

        assertThatThrownBy(() -> fetcher.fetch(URL, false, true, RenderOptions.none()))
                .isInstanceOf(ScrapeException.class)
                .hasMessage("Both HTTP and JavaScript scraping failed. HTTP error: HTTP down, JS error: JS down");
    }

    @Test
    void renderedFirstFallsBackToStatic() {
        when(renderedFetch.fetch(any(), any())).thenThrow(new RenderedScrapeException("JS down", URL, null));
        when(staticFetch.fetch(any(), any())).thenReturn("<html>static</html>");

        assertThat(fetcher.fetch(URL, true, false, RenderOptions.none())).isEqualTo("<html>static</html>");
    }

    @Test
    void bothFailingInRenderedFirstOrderCombinesErrors() {
        when(renderedFetch.fetch(any(), any())).thenThrow(new RenderedScrapeException("JS down", URL, null));
        when(staticFetch.fetch(any(), any())).thenThrow(new ScrapeException("HTTP down", URL));

        assertThatThrownBy(() -> fetcher.fetch(URL, true, false, RenderOptions.none()))
                .isInstanceOf(ScrapeException.class)
                .hasMessage("Both JavaScript and HTTP scraping failed. JS error: JS down, HTTP error: HTTP down");
    }
}
