package com.ai.webscraper.config;

import com.ai.webscraper.scraping.BrowserSession;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 공유 Chrome 세션 설정. 실제 브라우저는 첫 렌더링 요청 때 시작된다.
 */
@Slf4j
@Configuration
public class BrowserConfig {

    @Bean(destroyMethod = "close")
    public BrowserSession browserSession(ScraperConfig scraperConfig) {
        ScraperConfig.Browser browser = scraperConfig.getBrowser();
        Duration timeout = scraperConfig.requestTimeout();
        return new BrowserSession(() -> createWebDriver(browser, timeout));
    }

    static ChromeOptions chromeOptions(ScraperConfig.Browser browser) {
        ChromeOptions options = new ChromeOptions();
        if (browser.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-setuid-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--no-first-run");
        options.addArguments("--no-default-browser-check");
        options.addArguments("--disable-default-apps");
        options.addArguments("--disable-extensions");
        options.addArguments("--window-size=" + browser.getViewportWidth() + "," + browser.getViewportHeight());
        options.addArguments("--user-agent=" + browser.getUserAgent());
        options.setPageLoadStrategy(PageLoadStrategy.NORMAL);

        // 이미지 차단
        if (browser.isDisableImages()) {
            Map<String, Object> prefs = new HashMap<>();
            prefs.put("profile.managed_default_content_settings.images", 2);
            options.setExperimentalOption("prefs", prefs);
        }

        options.setExperimentalOption("excludeSwitches", List.of("enable-automation"));
        options.addArguments("--disable-blink-features=AutomationControlled");
        browser.getExtraArguments().forEach(options::addArguments);
        return options;
    }

    private static WebDriver createWebDriver(ScraperConfig.Browser browser, Duration timeout) {
        ChromeDriver driver = new ChromeDriver(chromeOptions(browser));
        driver.manage().timeouts().pageLoadTimeout(timeout);
        driver.manage().timeouts().scriptTimeout(timeout);
        log.info("ChromeDriver 생성 완료 - headless: {}, viewport: {}x{}",
                browser.isHeadless(), browser.getViewportWidth(), browser.getViewportHeight());
        return driver;
    }
}
