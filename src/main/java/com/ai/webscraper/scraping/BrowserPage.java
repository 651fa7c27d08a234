package com.ai.webscraper.scraping;

import java.time.Duration;

/**
 * 브라우저 세션에서 빌린 페이지 하나. 반드시 close()로 반납해야 한다.
 * 구현체는 Selenium 예외(TimeoutException, WebDriverException)를 그대로 던진다.
 */
public interface BrowserPage extends AutoCloseable {

    void setViewport(int width, int height);

    void navigate(String url);

    /**
     * document.readyState가 complete이고 리소스 요청 수가 idle 동안 변하지 않을 때까지 대기
     */
    void waitForNetworkIdle(Duration idle, Duration timeout);

    void waitForSelector(String cssSelector, Duration timeout);

    /**
     * JS 표현식이 truthy가 될 때까지 대기
     */
    void waitForFunction(String expression, Duration timeout);

    void scrollToBottom();

    /**
     * @return 제거된 요소 수
     */
    long removeElements(String cssSelector);

    String content();

    @Override
    void close();
}
