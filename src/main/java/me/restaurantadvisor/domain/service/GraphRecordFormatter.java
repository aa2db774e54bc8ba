package me.restaurantadvisor.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns flat graph records into single human-readable lines for handler
 * prompts. Absent or empty fields are left out.
 */
@Component
public class GraphRecordFormatter {

    private static final String SEPARATOR = " | ";

    public String location(Map<String, Object> record) {
        List<String> parts = new ArrayList<>();
        String head = "Location: " + text(record.get("area"));
        if (record.get("score") != null) {
            head += " - Overall Score: " + number(record.get("score"));
        }
        parts.add(head);
        addField(parts, "Type", record.get("type"));
        addField(parts, "Foot Traffic", record.get("foot_traffic"));
        addField(parts, "Competition Level", record.get("competition_score"));
        addField(parts, "Growth Potential", record.get("growth_potential"));
        addField(parts, "Rent Value", record.get("rent_score"));
        addField(parts, "Popular Cuisines", record.get("popular_cuisines"));
        addField(parts, "Key Demographics", record.get("demographics"));
        return String.join(SEPARATOR, parts);
    }

    public String locationDetails(Map<String, Object> record) {
        List<String> parts = new ArrayList<>();
        String head = "Area: " + text(record.get("area"));
        if (!isEmpty(record.get("type"))) {
            head += " (" + text(record.get("type")) + ")";
        }
        parts.add(head);
        addField(parts, "Foot Traffic", record.get("foot_traffic"));
        addField(parts, "Rent Range", record.get("rent_range"));
        addField(parts, "Popular Cuisines", record.get("popular_cuisines"));
        addField(parts, "Demographics", record.get("demographics"));
        addField(parts, "Public Transport", record.get("public_transport"));
        addField(parts, "Parking", record.get("parking"));
        addField(parts, "Nearby Areas", record.get("connectivity"));
        return String.join(SEPARATOR, parts);
    }

    public String regulation(Map<String, Object> record) {
        List<String> parts = new ArrayList<>();
        parts.add("Regulation: " + text(record.get("type")));
        addField(parts, "Description", record.get("description"));
        addField(parts, "Authority", record.get("authority"));
        addField(parts, "Requirements", record.get("requirements"));
        addField(parts, "Timeline", record.get("timeline"));
        addField(parts, "Cost", record.get("cost"));
        addField(parts, "Renewal", record.get("renewal"));
        return String.join(SEPARATOR, parts);
    }

    public String cuisine(Map<String, Object> record) {
        return "Cuisine: " + text(record.get("cuisine_type"))
                + " - Popularity Score: " + text(record.get("popularity"));
    }

    public String demographics(Map<String, Object> record) {
        List<String> parts = new ArrayList<>();
        String head = "City: " + text(record.get("name"));
        if (!isEmpty(record.get("state"))) {
            head += ", " + text(record.get("state"));
        }
        parts.add(head);
        addField(parts, "Population", record.get("population"));
        addField(parts, "Demographics", record.get("demographics"));
        addField(parts, "Key Markets", record.get("key_markets"));
        return String.join(SEPARATOR, parts);
    }

    /**
     * Short city overview used when no specialized lookup applies.
     */
    public List<String> citySummary(String city, int regulationCount, List<Map<String, Object>> locations,
            List<Map<String, Object>> cuisines) {
        return List.of(
                "City: " + city,
                "Number of regulations: " + regulationCount,
                "Top locations: " + joinField(locations, "area"),
                "Popular cuisines: " + joinField(cuisines, "cuisine_type"));
    }

    private static String joinField(List<Map<String, Object>> records, String field) {
        return records.stream()
                .map(record -> record.get(field))
                .filter(value -> !isEmpty(value))
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
    }

    private void addField(List<String> parts, String label, Object value) {
        if (!isEmpty(value)) {
            parts.add(label + ": " + text(value));
        }
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return value.toString().isBlank();
    }

    private static String text(Object value) {
        if (value == null) {
            return "unknown";
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        if (value instanceof Double || value instanceof Float) {
            return number(value);
        }
        return value.toString();
    }

    private static String number(Object value) {
        if (value instanceof Number n) {
            return String.format(Locale.ROOT, "%.2f", n.doubleValue());
        }
        return String.valueOf(value);
    }
}
