package com.ai.webscraper.scraping;

import com.ai.webscraper.concurrent.RecordingSleeper;
import com.ai.webscraper.config.ScraperConfig;
import com.ai.webscraper.dto.RenderOptions;
import com.ai.webscraper.exception.OperationTimeoutException;
import com.ai.webscraper.exception.RenderedScrapeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.openqa.selenium.SessionNotCreatedException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RenderedFetcherTest {

    private static final String URL = "https://spa.example.com";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @Mock
    private BrowserSession session;
    @Mock
    private BrowserPage page;

    private RecordingSleeper sleeper;
    private ScraperConfig.Browser browser;
    private RenderedFetcher fetcher;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        browser = new ScraperConfig.Browser();
        when(session.acquirePage()).thenReturn(page);
        when(page.content()).thenReturn("<html><body>rendered</body></html>");
        fetcher = new RenderedFetcher(session, browser, TIMEOUT, sleeper);
    }

    @Test
    void rendersPageInOrderAndClosesIt() {
        RenderOptions options = RenderOptions.builder()
                .waitForSelector("#app")
                .waitForFunction("window.ready")
                .removeSelector(".ad")
                .build();

        String html = fetcher.fetch(URL, options);

        assertThat(html).contains("rendered");
        InOrder order = inOrder(page);
        order.verify(page).setViewport(1366, 768);
        order.verify(page).navigate(URL);
        order.verify(page).waitForNetworkIdle(Duration.ofMillis(500), TIMEOUT);
        order.verify(page).waitForSelector("#app", TIMEOUT);
        order.verify(page).waitForFunction("window.ready", TIMEOUT);
        order.verify(page).scrollToBottom();
        order.verify(page).removeElements(".ad");
        order.verify(page).content();
        order.verify(page).close();
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(2000));
    }

    @Test
    void noOptionsSkipsWaits() {
        fetcher.fetch(URL, null);

        verify(page, never()).waitForSelector(anyString(), any());
        verify(page, never()).waitForFunction(anyString(), any());
        verify(page).close();
    }

    @Test
    void selectorTimeoutIsRenderedErrorAndPageIsClosed() {
        doThrow(new TimeoutException("expected condition failed")).when(page).waitForSelector(eq("#missing"), any());

        assertThatThrownBy(() -> fetcher.fetch(URL, RenderOptions.builder().waitForSelector("#missing").build()))
                .isInstanceOf(RenderedScrapeException.class)
                .hasMessage("Timeout waiting for selector: #missing");
        verify(page).close();
    }

    @Test
    void navigationTimeoutIsOperationTimeout() {
        doThrow(new TimeoutException("page load")).when(page).navigate(URL);

        assertThatThrownBy(() -> fetcher.fetch(URL, RenderOptions.none()))
                .isInstanceOf(OperationTimeoutException.class)
                .hasMessage("JavaScript scraping timed out");
        verify(page).close();
    }

    @Test
    void driverErrorIsRenderedErrorAndPageIsClosed() {
        doThrow(new WebDriverException("net::ERR_NAME_NOT_RESOLVED\nBuild info: x")).when(page).navigate(URL);

        assertThatThrownBy(() -> fetcher.fetch(URL, RenderOptions.none()))
                .isInstanceOf(RenderedScrapeException.class)
                .hasMessage("Unexpected error during JavaScript scraping")
                .satisfies(e -> assertThat(((RenderedScrapeException) e).getContext())
                        .isEqualTo("Error: net::ERR_NAME_NOT_RESOLVED"));
        verify(page).close();
    }

    @Test
    void blankContentIsAnError() {
        when(page.content()).thenReturn("  ");

        assertThatThrownBy(() -> fetcher.fetch(URL, RenderOptions.none()))
                .isInstanceOf(RenderedScrapeException.class)
                .hasMessage("Rendered page has no content");
        verify(page).close();
    }

    @Test
    void failingElementRemovalIsNotFatal() {
        when(page.removeElements(".broken")).thenThrow(new WebDriverException("invalid selector"));

        String html = fetcher.fetch(URL, RenderOptions.builder().removeSelector(".broken").build());

        assertThat(html).contains("rendered");
    }

    @Test
    void browserLaunchFailureIsRenderedError() {
        when(session.acquirePage()).thenThrow(new SessionNotCreatedException("chrome not found"));

        assertThatThrownBy(() -> fetcher.fetch(URL, RenderOptions.none()))
                .isInstanceOf(RenderedScrapeException.class)
                .hasMessage("Failed to initialize browser");
    }
}
