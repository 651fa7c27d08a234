package com.ai.webscraper.scraping;

import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WindowType;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Answers.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrowserSessionTest {

    private WebDriver driver() {
        WebDriver driver = mock(WebDriver.class, RETURNS_DEEP_STUBS);
        when(driver.getWindowHandle()).thenReturn("home");
        return driver;
    }

    @Test
    void browserStartsLazilyOnce() {
        WebDriver driver = driver();
        AtomicInteger launches = new AtomicInteger();
        BrowserSession session = new BrowserSession(() -> {
            launches.incrementAndGet();
            return driver;
        });

        assertThat(session.isStarted()).isFalse();
        session.acquirePage().close();
        session.acquirePage().close();

        assertThat(session.isStarted()).isTrue();
        assertThat(launches).hasValue(1);
    }

    @Test
    void pageOpensTabAndReturnsHomeOnClose() {
        WebDriver driver = driver();
        BrowserSession session = new BrowserSession(() -> driver);

        BrowserPage page = session.acquirePage();
        page.close();
        page.close();

        verify(driver.switchTo()).newWindow(WindowType.TAB);
        verify(driver, times(1)).close();
        verify(driver.switchTo()).window("home");
    }

    @Test
    void secondPageWaitsUntilFirstIsClosed() throws Exception {
        BrowserSession session = new BrowserSession(this::driver);
        BrowserPage first = session.acquirePage();
        AtomicBoolean secondAcquired = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);

        Thread other = new Thread(() -> {
            try (BrowserPage second = session.acquirePage()) {
                secondAcquired.set(true);
            } finally {
                done.countDown();
            }
        });
        other.start();

        assertThat(done.await(200, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(secondAcquired).isFalse();

        first.close();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(secondAcquired).isTrue();
    }

    @Test
    void closeQuitsDriverAndRejectsNewPages() {
        WebDriver driver = driver();
        BrowserSession session = new BrowserSession(() -> driver);
        session.acquirePage().close();

        session.close();
        session.close();

        verify(driver, times(1)).quit();
        assertThat(session.isStarted()).isFalse();
        assertThatThrownBy(session::acquirePage)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Browser session is closed");
    }

    @Test
    void closingUnstartedSessionDoesNothing() {
        AtomicInteger launches = new AtomicInteger();
        BrowserSession session = new BrowserSession(() -> {
            launches.incrementAndGet();
            return driver();
        });

        session.close();

        assertThat(launches).hasValue(0);
    }
}
