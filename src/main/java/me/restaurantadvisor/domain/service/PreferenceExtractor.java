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

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts long-term preferences (cuisine, city, budget tier) from message
 * text using fixed keyword tables. When several entries of one table match,
 * the one listed last wins, so "south indian" overrides "indian".
 */
@Component
@RequiredArgsConstructor
public class PreferenceExtractor {

    public static final String CUISINE = "cuisine";
    public static final String CITY = "city";
    public static final String BUDGET = "budget";

    private static final Map<String, String> CUISINE_KEYWORDS = orderedTable(
            "italian", "Italian",
            "chinese", "Chinese",
            "indian", "Indian",
            "mexican", "Mexican",
            "thai", "Thai",
            "japanese", "Japanese",
            "french", "French",
            "mediterranean", "Mediterranean",
            "american", "American",
            "middle eastern", "Middle Eastern",
            "south indian", "South Indian",
            "north indian", "North Indian",
            "punjabi", "Punjabi",
            "bengali", "Bengali",
            "gujarati", "Gujarati");

    private static final Map<String, String> BUDGET_PHRASES = orderedTable(
            "low budget", "Low",
            "budget friendly", "Low",
            "affordable", "Low",
            "mid budget", "Medium",
            "medium budget", "Medium",
            "moderate", "Medium",
            "high budget", "High",
            "luxury", "High",
            "premium", "High",
            "expensive", "High");

    private final CityGazetteer gazetteer;

    /**
     * Returns the preference values found in the text, keyed by preference
     * name. Keys without a match are absent.
     */
    public Map<String, String> extract(String text) {
        Map<String, String> found = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        scan(lower, CUISINE_KEYWORDS, CUISINE, found);

        List<String> cities = gazetteer.findAll(text);
        if (!cities.isEmpty()) {
            found.put(CITY, cities.get(cities.size() - 1));
        }

        scan(lower, BUDGET_PHRASES, BUDGET, found);
        return found;
    }

    private void scan(String lower, Map<String, String> table, String key, Map<String, String> found) {
        table.forEach((keyword, value) -> {
            if (lower.contains(keyword)) {
                found.put(key, value);
            }
        });
    }

    private static Map<String, String> orderedTable(String... pairs) {
        Map<String, String> table = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            table.put(pairs[i], pairs[i + 1]);
        }
        return table;
    }
}
