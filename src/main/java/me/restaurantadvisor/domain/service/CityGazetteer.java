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
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed list of cities the advisor recognizes in free text. Matching is a
 * case-insensitive substring scan in list order.
 */
@Component
public class CityGazetteer {

    private static final List<String> CITIES = List.of(
            "mumbai", "delhi", "bangalore", "hyderabad", "kolkata",
            "chennai", "pune", "ahmedabad", "jaipur", "lucknow");

    /**
     * First known city mentioned in the text, title-cased.
     */
    public Optional<String> findFirst(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return CITIES.stream()
                .filter(lower::contains)
                .map(CityGazetteer::titleCase)
                .findFirst();
    }

    /**
     * All known cities mentioned in the text, title-cased, in list order.
     */
    public List<String> findAll(String text) {
        List<String> found = new ArrayList<>();
        if (text == null) {
            return found;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String city : CITIES) {
            if (lower.contains(city)) {
                found.add(titleCase(city));
            }
        }
        return found;
    }

    public List<String> knownCities() {
        return CITIES.stream().map(CityGazetteer::titleCase).toList();
    }

    static String titleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean capitalizeNext = true;
        for (char c : value.toCharArray()) {
            if (Character.isWhitespace(c)) {
                capitalizeNext = true;
                sb.append(c);
            } else if (capitalizeNext) {
                sb.append(Character.toUpperCase(c));
                capitalizeNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
