package com.ai.webscraper.config;

import com.ai.webscraper.service.AiExtractionService;
import com.ai.webscraper.service.factory.AiExtractionServiceFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AiServiceConfig {

    // ai.provider / ai.model 설정으로 기본 제공자 서비스 생성
    @Bean
    public AiExtractionService aiExtractionService(AiExtractionServiceFactory factory) {
        AiExtractionService service = factory.createDefault();
        log.info("AI 추출 서비스 준비 완료: {} ({})", service.getProviderName(), service.getModelName());
        return service;
    }
}
