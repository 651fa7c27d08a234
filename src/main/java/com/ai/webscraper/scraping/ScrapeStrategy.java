package com.ai.webscraper.scraping;

import com.ai.webscraper.dto.RenderOptions;

/**
 * 페이지 내용을 가져오는 방식 (정적 HTTP / 헤드리스 브라우저 렌더링)
 */
public interface ScrapeStrategy {

    /**
     * @return 페이지 HTML
     * @throws com.ai.webscraper.exception.ScraperException 수집 실패
     */
    String fetch(String url, RenderOptions options);

    String name();
}
