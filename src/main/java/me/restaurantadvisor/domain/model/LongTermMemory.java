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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-session knowledge about a user: deduplicated facts, last-write-wins
 * preferences, a bounded history of recent queries and a keyed insight cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LongTermMemory {

    @Builder.Default
    private List<String> facts = new ArrayList<>();

    @Builder.Default
    private Map<String, String> preferences = new LinkedHashMap<>();

    @Builder.Default
    private List<String> recentQueries = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> insights = new LinkedHashMap<>();

    public boolean addFact(String fact) {
        if (fact == null || fact.isBlank() || facts.contains(fact)) {
            return false;
        }
        facts.add(fact);
        return true;
    }

    public void putPreference(String key, String value) {
        preferences.put(key, value);
    }

    public void addQuery(String query, int capacity) {
        recentQueries.add(query);
        int overflow = recentQueries.size() - Math.max(capacity, 0);
        if (overflow > 0) {
            recentQueries.subList(0, overflow).clear();
        }
    }

    public List<String> lastQueries(int count) {
        int from = Math.max(0, recentQueries.size() - count);
        return List.copyOf(recentQueries.subList(from, recentQueries.size()));
    }

    public void putInsight(String key, Object insight) {
        insights.put(key, insight);
    }
}
