package com.ai.webscraper;

import com.ai.webscraper.config.AiModelConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AiModelConfig.class)
public class AiWebScraperApplication {
    public static void main(String[] args) {
        SpringApplication.run(AiWebScraperApplication.class, args);
    }
}
