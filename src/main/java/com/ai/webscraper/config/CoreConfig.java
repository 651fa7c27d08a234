package com.ai.webscraper.config;

import com.ai.webscraper.concurrent.Retrier;
import com.ai.webscraper.concurrent.Sleeper;
import com.ai.webscraper.scraping.ContentFetcher;
import com.ai.webscraper.scraping.DynamicContentHeuristic;
import com.ai.webscraper.scraping.RenderedFetcher;
import com.ai.webscraper.scraping.StaticFetcher;
import com.ai.webscraper.service.HtmlPreprocessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public Retrier retrier(Sleeper sleeper) {
        return new Retrier(sleeper);
    }

    @Bean
    public DynamicContentHeuristic dynamicContentHeuristic(ScraperConfig scraperConfig) {
        return new DynamicContentHeuristic(scraperConfig.getFallbackTokens());
    }

    @Bean
    public ContentFetcher contentFetcher(StaticFetcher staticFetcher, RenderedFetcher renderedFetcher,
                                         DynamicContentHeuristic heuristic) {
        return new ContentFetcher(staticFetcher, renderedFetcher, heuristic);
    }

    @Bean
    public HtmlPreprocessor htmlPreprocessor() {
        return new HtmlPreprocessor();
    }
}
