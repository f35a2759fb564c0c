package com.glyphlate.backend.services.language;

import java.util.List;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Calls the translation service's {@code /detect} endpoint (LibreTranslate format).
 */
@Slf4j
public class RemoteLanguageDetector implements LanguageDetector {

    private final RestTemplate restTemplate;
    private final String apiKey;

    public RemoteLanguageDetector(RestTemplate restTemplate, String apiKey) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    @Override
    public String detect(String text) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("q", text);
        if (!apiKey.isEmpty()) {
            form.add("api_key", apiKey);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            Detection[] detections = restTemplate.postForObject("/detect", new HttpEntity<>(form, headers), Detection[].class);
            List<Detection> list = detections == null ? List.of() : List.of(detections);
            if (list.isEmpty() || list.get(0).language() == null || list.get(0).language().isBlank()) {
                log.warn("[Detect] Empty detection response, using '{}'", ScriptLanguageDetector.DEFAULT_LANGUAGE);
                return ScriptLanguageDetector.DEFAULT_LANGUAGE;
            }
            return list.get(0).language();
        } catch (RestClientException e) {
            throw new IllegalStateException("Language detection failed: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Detection(String language, double confidence) {
    }
}
