package com.glyphlate.backend.services.translation;

import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.glyphlate.backend.config.ImageTranslationProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Client for a LibreTranslate-compatible {@code POST /translate} endpoint.
 */
@Component
@Slf4j
public class LibreTranslateEngine implements TranslationEngine {

    private final RestTemplate restTemplate;
    private final String apiKey;

    public LibreTranslateEngine(RestTemplate restTemplate, ImageTranslationProperties properties) {
        this.restTemplate = restTemplate;
        String key = properties.getTranslation().getApiKey();
        this.apiKey = key == null || key.isBlank() ? null : key.trim();
    }

    @Override
    public String translate(String fromLang, String toLang, String text, boolean html) {
        TranslateRequest request = new TranslateRequest(text, fromLang, toLang, html ? "html" : "text", apiKey);

        TranslateResponse response;
        try {
            response = restTemplate.postForObject("/translate", request, TranslateResponse.class);
        } catch (RestClientException e) {
            throw new TranslationException("Translation request failed (" + fromLang + " -> " + toLang + "): " + e.getMessage(), e);
        }

        if (response == null || response.translatedText() == null) {
            throw new TranslationException("Translation service returned no text (" + fromLang + " -> " + toLang + ")");
        }
        return response.translatedText();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TranslateRequest(
            String q,
            String source,
            String target,
            String format,
            @JsonProperty("api_key") String apiKey
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TranslateResponse(String translatedText) {
    }
}
