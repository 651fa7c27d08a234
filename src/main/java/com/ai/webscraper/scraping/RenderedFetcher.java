package com.ai.webscraper.scraping;

import com.ai.webscraper.concurrent.Sleeper;
import com.ai.webscraper.config.ScraperConfig;
import com.ai.webscraper.dto.RenderOptions;
import com.ai.webscraper.exception.OperationTimeoutException;
import com.ai.webscraper.exception.RenderedScrapeException;
import com.ai.webscraper.exception.ScraperException;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 헤드리스 브라우저 렌더링 수집.
 * 페이지는 모든 경로(성공, 오류, 타임아웃)에서 닫힌다. 브라우저 프로세스는 세션 소유자가 종료한다.
 */
@Slf4j
@Component
public class RenderedFetcher implements ScrapeStrategy {

    private final BrowserSession session;
    private final ScraperConfig.Browser browser;
    private final Duration timeout;
    private final Sleeper sleeper;

    @Autowired
    public RenderedFetcher(BrowserSession session, ScraperConfig config, Sleeper sleeper) {
        this(session, config.getBrowser(), config.requestTimeout(), sleeper);
    }

    public RenderedFetcher(BrowserSession session, ScraperConfig.Browser browser, Duration timeout, Sleeper sleeper) {
        this.session = session;
        this.browser = browser;
        this.timeout = timeout;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return "JavaScript";
    }

    @Override
    public String fetch(String url, RenderOptions options) {
        RenderOptions render = options != null ? options : RenderOptions.none();

        BrowserPage page;
        try {
            page = session.acquirePage();
        } catch (WebDriverException | IllegalStateException e) {
            throw new RenderedScrapeException("Failed to initialize browser", url,
                    "Browser launch error: " + e.getMessage(), e);
        }

        try (page) {
            page.setViewport(browser.getViewportWidth(), browser.getViewportHeight());
            page.navigate(url);
            page.waitForNetworkIdle(Duration.ofMillis(browser.getNetworkIdleMs()), timeout);

            waitForConditions(page, url, render);
            removeElements(page, render);

            String html = page.content();
            if (html == null || html.isBlank()) {
                throw new RenderedScrapeException("Rendered page has no content", url, null);
            }
            log.debug("렌더링 수집 완료: {} ({} chars)", url, html.length());
            return html;
        } catch (ScraperException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new OperationTimeoutException("JavaScript scraping timed out",
                    "JavaScript page rendering for " + url, timeout);
        } catch (WebDriverException e) {
            throw new RenderedScrapeException("Unexpected error during JavaScript scraping", url,
                    "Error: " + firstLine(e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderedScrapeException("JavaScript scraping interrupted", url, null, e);
        }
    }

    private void waitForConditions(BrowserPage page, String url, RenderOptions render) throws InterruptedException {
        if (render.getWaitForSelector() != null && !render.getWaitForSelector().isBlank()) {
            try {
                page.waitForSelector(render.getWaitForSelector(), timeout);
            } catch (TimeoutException e) {
                throw new RenderedScrapeException("Timeout waiting for selector: " + render.getWaitForSelector(),
                        url, "Selector wait timeout: " + firstLine(e.getMessage()), e);
            }
        }

        if (render.getWaitForFunction() != null && !render.getWaitForFunction().isBlank()) {
            try {
                page.waitForFunction(render.getWaitForFunction(), timeout);
            } catch (TimeoutException e) {
                throw new RenderedScrapeException("Timeout waiting for function: " + render.getWaitForFunction(),
                        url, "Function wait timeout: " + firstLine(e.getMessage()), e);
            }
        }

        // 지연 로딩 콘텐츠
        if (browser.getSettleDelayMs() > 0) {
            sleeper.sleep(Duration.ofMillis(browser.getSettleDelayMs()));
        }
        if (browser.isScrollToBottom()) {
            page.scrollToBottom();
        }
    }

    private void removeElements(BrowserPage page, RenderOptions render) {
        for (String selector : render.getRemoveSelectors()) {
            try {
                long removed = page.removeElements(selector);
                log.debug("요소 제거 '{}': {}개", selector, removed);
            } catch (WebDriverException e) {
                log.warn("요소 제거 실패 '{}': {}", selector, firstLine(e.getMessage()));
            }
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
