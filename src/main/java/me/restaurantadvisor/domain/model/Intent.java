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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Handling paths a query can be routed to. Wire names match the identifiers
 * returned by the classifier and used in the access policy table.
 */
public enum Intent {

    LOCATION_RECOMMENDER("location_recommender"),
    REGULATORY_ADVISOR("regulatory_advisor"),
    MARKET_ANALYSIS("market_analysis"),
    CONSUMER_SURVEY("consumer_survey"),
    REAL_ESTATE("real_estate"),
    DEMOGRAPHICS("demographics"),
    PDF_RESEARCH("pdf_research"),
    DOMAIN_SPECIALIST("domain_specialist"),
    BASIC_QUERY("basic_query");

    /**
     * Universal fallback that every role may reach.
     */
    public static final Intent FALLBACK = BASIC_QUERY;

    private final String wireName;

    Intent(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isFallback() {
        return this == FALLBACK;
    }

    public static Optional<Intent> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(intent -> intent.wireName.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
