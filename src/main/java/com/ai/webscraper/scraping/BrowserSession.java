package com.ai.webscraper.scraping;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 공유 헤드리스 브라우저 프로세스.
 * 처음 페이지를 빌릴 때 시작되고, 종료 시 {@link #close()}로 한 번만 닫는다.
 * WebDriver는 스레드 안전하지 않으므로 페이지는 한 번에 하나씩 (공정 순서로) 빌려준다.
 */
@Slf4j
public class BrowserSession implements AutoCloseable {

    private final Supplier<WebDriver> driverFactory;
    private final ReentrantLock pageLock = new ReentrantLock(true);
    private final Object lifecycleLock = new Object();

    private WebDriver driver;
    private String homeHandle;
    private boolean closed;

    public BrowserSession(Supplier<WebDriver> driverFactory) {
        this.driverFactory = driverFactory;
    }

    /**
     * 새 페이지(탭)를 연다. 다른 페이지가 열려 있으면 닫힐 때까지 대기한다.
     * try-with-resources로 반납할 것.
     */
    public BrowserPage acquirePage() {
        pageLock.lock();
        try {
            WebDriver current = ensureStarted();
            return new SeleniumBrowserPage(current, homeHandle, pageLock::unlock);
        } catch (RuntimeException e) {
            pageLock.unlock();
            throw e;
        }
    }

    public boolean isStarted() {
        synchronized (lifecycleLock) {
            return driver != null;
        }
    }

    private WebDriver ensureStarted() {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Browser session is closed");
            }
            if (driver == null) {
                log.info("헤드리스 브라우저 시작");
                driver = driverFactory.get();
                homeHandle = driver.getWindowHandle();
            }
            return driver;
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            closed = true;
            if (driver == null) {
                return;
            }
            try {
                driver.quit();
                log.info("헤드리스 브라우저 종료");
            } catch (WebDriverException e) {
                log.warn("브라우저 종료 중 오류", e);
            } finally {
                driver = null;
                homeHandle = null;
            }
        }
    }
}
