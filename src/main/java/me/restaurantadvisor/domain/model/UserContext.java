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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Read-only digest of a user's memory passed to intent handlers.
 */
@Value
@Builder
public class UserContext {

    @Builder.Default
    Map<String, String> preferences = Map.of();

    @Builder.Default
    List<String> recentQueries = List.of();

    @Builder.Default
    List<String> facts = List.of();

    @Builder.Default
    Map<String, Object> insights = Map.of();

    @Builder.Default
    Map<String, Object> session = Map.of();

    public boolean isEmpty() {
        return preferences.isEmpty() && recentQueries.isEmpty() && facts.isEmpty() && insights.isEmpty();
    }

    /**
     * Formats the context as a markdown block for inclusion in prompts.
     */
    public String toPromptSection() {
        StringBuilder sb = new StringBuilder();
        if (!preferences.isEmpty()) {
            sb.append("Known preferences:\n");
            preferences.forEach((key, value) -> sb.append("- ").append(key).append(": ").append(value).append('\n'));
        }
        if (!recentQueries.isEmpty()) {
            sb.append("Recent questions:\n");
            recentQueries.forEach(q -> sb.append("- ").append(q).append('\n'));
        }
        if (!facts.isEmpty()) {
            sb.append("Known facts:\n");
            facts.forEach(f -> sb.append("- ").append(f).append('\n'));
        }
        return sb.toString().trim();
    }
}
