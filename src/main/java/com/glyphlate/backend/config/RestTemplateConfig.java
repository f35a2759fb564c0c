package com.glyphlate.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate used by the translation and remote detection clients.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ImageTranslationProperties properties) {
        int timeoutSeconds = properties.getTranslation().getTimeoutSeconds();
        if (timeoutSeconds <= 0) timeoutSeconds = 30;

        Duration timeout = Duration.ofSeconds(timeoutSeconds);

        return builder
                .rootUri(trimTrailingSlash(properties.getTranslation().getBaseUrl()))
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) return "";
        String u = url.trim();
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}
