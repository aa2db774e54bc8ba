package me.restaurantadvisor.domain.service;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphRecordFormatterTest {

    private final GraphRecordFormatter formatter = new GraphRecordFormatter();

    @Test
    void location_formatsScoreAndListFields() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("area", "Koregaon Park");
        record.put("type", "Commercial");
        record.put("score", 0.8125);
        record.put("foot_traffic", 9L);
        record.put("popular_cuisines", List.of("Italian", "Cafe"));

        String line = formatter.location(record);

        assertEquals("Location: Koregaon Park - Overall Score: 0.81 | Type: Commercial | Foot Traffic: 9"
                + " | Popular Cuisines: Italian, Cafe", line);
    }

    @Test
    void location_omitsEmptyFields() {
        Map<String, Object> record = new HashMap<>();
        record.put("area", "Baner");
        record.put("demographics", List.of());
        record.put("type", " ");

        assertEquals("Location: Baner", formatter.location(record));
    }

    @Test
    void regulation_includesOptionalFieldsWhenPresent() {
        Map<String, Object> record = new HashMap<>();
        record.put("type", "FSSAI License");
        record.put("authority", "FSSAI");
        record.put("cost", "Rs 7500");

        String line = formatter.regulation(record);

        assertTrue(line.startsWith("Regulation: FSSAI License"));
        assertTrue(line.contains("Authority: FSSAI"));
        assertTrue(line.contains("Cost: Rs 7500"));
        assertFalse(line.contains("Timeline"));
    }

    @Test
    void cuisine_formatsPopularity() {
        String line = formatter.cuisine(Map.of("cuisine_type", "Biryani", "popularity", 4L));

        assertEquals("Cuisine: Biryani - Popularity Score: 4", line);
    }

    @Test
    void demographics_appendsStateToCity() {
        Map<String, Object> record = new HashMap<>();
        record.put("name", "Hyderabad");
        record.put("state", "Telangana");
        record.put("population", 10_000_000L);

        assertEquals("City: Hyderabad, Telangana | Population: 10000000", formatter.demographics(record));
    }

    @Test
    void locationDetails_namesUnknownAreaWhenMissing() {
        String line = formatter.locationDetails(Map.of("parking", "Limited"));

        assertEquals("Area: unknown | Parking: Limited", line);
    }

    @Test
    void citySummary_skipsRecordsWithoutName() {
        List<String> lines = formatter.citySummary("Pune", 0,
                List.of(Map.of("area", "Baner"), Map.of("score", 0.4)), List.of());

        assertEquals(List.of("City: Pune", "Number of regulations: 0", "Top locations: Baner",
                "Popular cuisines: "), lines);
    }
}
