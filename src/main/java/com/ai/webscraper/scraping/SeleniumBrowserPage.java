package com.ai.webscraper.scraping;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WindowType;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;

/**
 * 공유 WebDriver의 새 탭. 닫으면 탭을 닫고 원래 창으로 돌아간 뒤 세션 잠금을 해제한다.
 */
@Slf4j
class SeleniumBrowserPage implements BrowserPage {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    private static final String RESOURCE_COUNT = "return performance.getEntriesByType('resource').length;";

    private final WebDriver driver;
    private final String homeHandle;
    private final Runnable onClose;
    private boolean closed;

    SeleniumBrowserPage(WebDriver driver, String homeHandle, Runnable onClose) {
        this.driver = driver;
        this.homeHandle = homeHandle;
        this.onClose = onClose;
        driver.switchTo().newWindow(WindowType.TAB);
    }

    @Override
    public void setViewport(int width, int height) {
        driver.manage().window().setSize(new Dimension(width, height));
    }

    @Override
    public void navigate(String url) {
        driver.get(url);
    }

    @Override
    public void waitForNetworkIdle(Duration idle, Duration timeout) {
        WebDriverWait wait = new WebDriverWait(driver, timeout, POLL_INTERVAL);
        wait.until(d -> "complete".equals(js().executeScript("return document.readyState")));

        long[] lastCount = {-1L};
        long[] lastChange = {System.nanoTime()};
        wait.until(d -> {
            Object result = js().executeScript(RESOURCE_COUNT);
            long count = result instanceof Number number ? number.longValue() : 0L;
            long now = System.nanoTime();
            if (count != lastCount[0]) {
                lastCount[0] = count;
                lastChange[0] = now;
                return false;
            }
            return now - lastChange[0] >= idle.toNanos();
        });
    }

    @Override
    public void waitForSelector(String cssSelector, Duration timeout) {
        new WebDriverWait(driver, timeout, POLL_INTERVAL)
                .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(cssSelector)));
    }

    @Override
    public void waitForFunction(String expression, Duration timeout) {
        new WebDriverWait(driver, timeout, POLL_INTERVAL)
                .until(d -> {
                    Object result = js().executeScript("return !!(" + expression + ");");
                    return Boolean.TRUE.equals(result);
                });
    }

    @Override
    public void scrollToBottom() {
        js().executeScript("window.scrollTo(0, document.body.scrollHeight);");
    }

    @Override
    public long removeElements(String cssSelector) {
        Object removed = js().executeScript(
                "const els = document.querySelectorAll(arguments[0]); els.forEach(el => el.remove()); return els.length;",
                cssSelector);
        return removed instanceof Number number ? number.longValue() : 0L;
    }

    @Override
    public String content() {
        return driver.getPageSource();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            driver.close();
            driver.switchTo().window(homeHandle);
        } catch (WebDriverException e) {
            log.warn("브라우저 탭 종료 중 오류: {}", e.getMessage());
        } finally {
            onClose.run();
        }
    }

    private JavascriptExecutor js() {
        return (JavascriptExecutor) driver;
    }
}
