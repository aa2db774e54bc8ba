package me.restaurantadvisor.domain.model;

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

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Sub-capabilities of the domain specialist intent, in selection priority
 * order. Each domain is recognized by a fixed list of trigger terms.
 */
public enum SpecialistDomain {

    CUISINE("cuisine", List.of("cuisine", "food", "menu", "dish", "taste", "flavor", "recipe", "ingredient",
            "culinary", "chef", "cooking", "food trend")),
    FINANCIAL("financial", List.of("finance", "cost", "budget", "investment", "revenue", "profit", "break-even",
            "funding", "loan", "capital", "roi", "return", "expense", "financial", "money", "cash flow",
            "pricing")),
    STAFFING("staffing", List.of("staff", "employee", "hiring", "training", "workforce", "team", "chef", "waiter",
            "manager", "hr", "human resources", "personnel", "labor", "recruitment", "interview", "salary", "wage",
            "compensation")),
    MARKETING("marketing", List.of("marketing", "promotion", "advertis", "brand", "customer", "acquisition",
            "social media", "publicity", "influencer", "campaign", "digital marketing", "seo", "website",
            "online presence")),
    TECHNOLOGY("technology", List.of("technology", "system", "software", "hardware", "pos", "point of sale",
            "inventory", "digital", "online", "app", "mobile", "payment", "website", "reservation",
            "cybersecurity", "data", "cloud", "integration")),
    DESIGN("design", List.of("design", "interior", "decor", "ambiance", "atmosphere", "space", "layout",
            "lighting", "furniture", "fixture", "seating", "aesthetic", "look", "feel", "ambience", "style",
            "theme", "decoration"));

    private final String key;
    private final List<String> terms;

    SpecialistDomain(String key, List<String> terms) {
        this.key = key;
        this.terms = terms;
    }

    public String getKey() {
        return key;
    }

    public List<String> getTerms() {
        return terms;
    }

    /**
     * Trigger terms of this domain that occur in the text.
     */
    public List<String> matchedTerms(String text) {
        if (text == null) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return terms.stream().filter(lower::contains).toList();
    }

    /**
     * First domain, in priority order, that the query or parameters point at.
     * A {@code cuisine} parameter selects the cuisine domain.
     */
    public static Optional<SpecialistDomain> select(String query, Map<String, String> parameters) {
        for (SpecialistDomain domain : values()) {
            if (domain == CUISINE && parameters != null && parameters.get("cuisine") != null
                    && !parameters.get("cuisine").isBlank()) {
                return Optional.of(domain);
            }
            if (!domain.matchedTerms(query).isEmpty()) {
                return Optional.of(domain);
            }
        }
        return Optional.empty();
    }
}
