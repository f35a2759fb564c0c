package com.glyphlate.backend.services.language;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class RemoteLanguageDetectorTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplateBuilder().rootUri("http://libre.test").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    void detect_returnsTopLanguage() {
        server.expect(requestTo("http://libre.test/detect"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andRespond(withSuccess("[{\"language\":\"fr\",\"confidence\":92.0}]", MediaType.APPLICATION_JSON));

        String detected = new RemoteLanguageDetector(restTemplate, "").detect("Bonjour tout le monde");

        assertEquals("fr", detected);
        server.verify();
    }

    @Test
    void detect_emptyResponse_defaultsToEnglish() {
        server.expect(requestTo("http://libre.test/detect"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertEquals("en", new RemoteLanguageDetector(restTemplate, "key").detect("???"));
    }

    @Test
    void detect_serverError_throws() {
        server.expect(requestTo("http://libre.test/detect"))
                .andRespond(withServerError());

        RemoteLanguageDetector detector = new RemoteLanguageDetector(restTemplate, "");

        assertThrows(IllegalStateException.class, () -> detector.detect("hello"));
    }
}
