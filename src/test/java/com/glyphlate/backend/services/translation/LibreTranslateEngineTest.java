package com.glyphlate.backend.services.translation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
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

import com.glyphlate.backend.config.ImageTranslationProperties;

class LibreTranslateEngineTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplateBuilder().rootUri("http://libre.test").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    void translate_postsRequestAndReadsTranslatedText() {
        server.expect(requestTo("http://libre.test/translate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.q").value("Hello"))
                .andExpect(jsonPath("$.source").value("en"))
                .andExpect(jsonPath("$.target").value("fr"))
                .andExpect(jsonPath("$.format").value("text"))
                .andExpect(jsonPath("$.api_key").value("secret"))
                .andRespond(withSuccess("{\"translatedText\":\"Bonjour\"}", MediaType.APPLICATION_JSON));

        String result = new LibreTranslateEngine(restTemplate, props("secret")).translate("en", "fr", "Hello", false);

        assertEquals("Bonjour", result);
        server.verify();
    }

    @Test
    void translate_withoutApiKey_omitsField() {
        server.expect(requestTo("http://libre.test/translate"))
                .andExpect(jsonPath("$.api_key").doesNotExist())
                .andExpect(jsonPath("$.format").value("html"))
                .andRespond(withSuccess("{\"translatedText\":\"<b>Bonjour</b>\"}", MediaType.APPLICATION_JSON));

        String result = new LibreTranslateEngine(restTemplate, props("")).translate("en", "fr", "<b>Hello</b>", true);

        assertEquals("<b>Bonjour</b>", result);
    }

    @Test
    void translate_serverError_throwsTranslationException() {
        server.expect(requestTo("http://libre.test/translate")).andRespond(withServerError());

        LibreTranslateEngine engine = new LibreTranslateEngine(restTemplate, props(""));

        assertThrows(TranslationException.class, () -> engine.translate("en", "fr", "Hello", false));
    }

    @Test
    void translate_missingTranslatedText_throwsTranslationException() {
        server.expect(requestTo("http://libre.test/translate"))
                .andRespond(withSuccess("{\"error\":\"nope\"}", MediaType.APPLICATION_JSON));

        LibreTranslateEngine engine = new LibreTranslateEngine(restTemplate, props(""));

        assertThrows(TranslationException.class, () -> engine.translate("en", "fr", "Hello", false));
    }

    private static ImageTranslationProperties props(String apiKey) {
        ImageTranslationProperties props = new ImageTranslationProperties();
        props.getTranslation().setApiKey(apiKey);
        return props;
    }
}
