package com.glyphlate.backend.services.language;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import com.glyphlate.backend.config.ImageTranslationProperties;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class LanguageDetectionConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "glyphlate.detector", name = "mode", havingValue = "remote")
    public LanguageDetector remoteLanguageDetector(RestTemplate restTemplate, ImageTranslationProperties properties) {
        log.info("[Detect] Using remote detector at '{}'", properties.getTranslation().getBaseUrl());
        return new RemoteLanguageDetector(restTemplate, properties.getTranslation().getApiKey());
    }

    @Bean
    @ConditionalOnMissingBean(LanguageDetector.class)
    public LanguageDetector scriptLanguageDetector() {
        log.info("[Detect] Using script-based detector");
        return new ScriptLanguageDetector();
    }
}
