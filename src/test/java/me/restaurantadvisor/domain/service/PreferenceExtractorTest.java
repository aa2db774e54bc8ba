package me.restaurantadvisor.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PreferenceExtractorTest {

    private final PreferenceExtractor extractor = new PreferenceExtractor(new CityGazetteer());

    @Test
    void extract_findsCuisineCityAndBudget() {
        Map<String, String> found = extractor.extract("Looking for an affordable Italian place in Pune");

        assertEquals("Italian", found.get(PreferenceExtractor.CUISINE));
        assertEquals("Pune", found.get(PreferenceExtractor.CITY));
        assertEquals("Low", found.get(PreferenceExtractor.BUDGET));
    }

    @Test
    void extract_moreSpecificCuisineWins() {
        Map<String, String> found = extractor.extract("I want to open a south indian tiffin centre");

        assertEquals("South Indian", found.get(PreferenceExtractor.CUISINE));
    }

    @Test
    void extract_lastListedCityWinsWhenSeveralMatch() {
        Map<String, String> found = extractor.extract("Compare Mumbai and Chennai");

        assertEquals("Chennai", found.get(PreferenceExtractor.CITY));
    }

    @Test
    void extract_premiumMapsToHighBudget() {
        Map<String, String> found = extractor.extract("a premium fine dining concept");

        assertEquals("High", found.get(PreferenceExtractor.BUDGET));
        assertFalse(found.containsKey(PreferenceExtractor.CUISINE));
        assertFalse(found.containsKey(PreferenceExtractor.CITY));
    }

    @Test
    void extract_isCaseInsensitive() {
        Map<String, String> found = extractor.extract("THAI FOOD IN DELHI");

        assertEquals("Thai", found.get(PreferenceExtractor.CUISINE));
        assertEquals("Delhi", found.get(PreferenceExtractor.CITY));
    }

    @Test
    void extract_returnsEmptyMapForBlankOrNull() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
        assertTrue(extractor.extract("hello there").isEmpty());
    }
}
