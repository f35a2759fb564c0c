package com.glyphlate.backend.services.translation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;

import com.glyphlate.backend.config.ImageTranslationProperties;

class PivotTranslationClientTest {

    private final TranslationEngine engine = mock(TranslationEngine.class);

    @Test
    void translate_sameLanguage_returnsTextWithoutCallingEngine() {
        PivotTranslationClient client = client("", 10);

        assertEquals("Hello", client.translate("en", "EN", "Hello", false));
        verify(engine, never()).translate(anyString(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void translate_cachesResults() {
        when(engine.translate("en", "fr", "Hello", false)).thenReturn("Bonjour");
        PivotTranslationClient client = client("", 10);

        assertEquals("Bonjour", client.translate("en", "fr", "Hello", false));
        assertEquals("Bonjour", client.translate("en", "fr", "Hello", false));

        verify(engine, times(1)).translate("en", "fr", "Hello", false);
    }

    @Test
    void translate_throughPivotLanguage() {
        when(engine.translate("ja", "en", "出口", false)).thenReturn("Exit");
        when(engine.translate("en", "fr", "Exit", false)).thenReturn("Sortie");
        PivotTranslationClient client = client("en", 10);

        assertEquals("Sortie", client.translate("ja", "fr", "出口", false));
    }

    @Test
    void translate_pivotIsOneSide_goesDirect() {
        when(engine.translate("en", "fr", "Exit", false)).thenReturn("Sortie");
        PivotTranslationClient client = client("en", 10);

        assertEquals("Sortie", client.translate("en", "fr", "Exit", false));
        verify(engine, times(1)).translate(anyString(), anyString(), anyString(), anyBoolean());
    }

    @Test
    void translate_engineFailure_propagatesAndIsNotCached() {
        when(engine.translate("en", "fr", "Hello", false))
                .thenThrow(new TranslationException("down"))
                .thenReturn("Bonjour");
        PivotTranslationClient client = client("", 10);

        assertThrows(TranslationException.class, () -> client.translate("en", "fr", "Hello", false));
        assertEquals("Bonjour", client.translate("en", "fr", "Hello", false));
    }

    @Test
    void translate_blankText_isReturnedAsIs() {
        PivotTranslationClient client = client("", 10);

        assertEquals("  ", client.translate("en", "fr", "  ", false));
        verify(engine, never()).translate(anyString(), anyString(), anyString(), anyBoolean());
    }

    private PivotTranslationClient client(String pivot, int cacheSize) {
        ImageTranslationProperties props = new ImageTranslationProperties();
        props.getTranslation().setPivotLanguage(pivot);
        return new PivotTranslationClient(engine, new TranslationCache(cacheSize), props);
    }
}
