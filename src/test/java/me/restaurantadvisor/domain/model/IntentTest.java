package me.restaurantadvisor.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IntentTest {

    @Test
    void fromName_isCaseInsensitiveAndTrimmed() {
        assertEquals(Optional.of(Intent.PDF_RESEARCH), Intent.fromName(" PDF_Research "));
    }

    @Test
    void fromName_rejectsUnknownOrBlank() {
        assertTrue(Intent.fromName("weather").isEmpty());
        assertTrue(Intent.fromName("").isEmpty());
        assertTrue(Intent.fromName(null).isEmpty());
    }

    @Test
    void fallbackIsBasicQuery() {
        assertTrue(Intent.BASIC_QUERY.isFallback());
        assertFalse(Intent.DEMOGRAPHICS.isFallback());
        assertEquals("basic_query", Intent.FALLBACK.toString());
    }
}
