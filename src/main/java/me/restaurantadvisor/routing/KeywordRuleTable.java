package me.restaurantadvisor.routing;

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

import me.restaurantadvisor.domain.model.Intent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered keyword rules mapping query terms to intents and default
 * parameters. The router uses the same table for the deterministic fallback
 * cascade and for filling defaults into classifier decisions.
 *
 * <p>
 * Priority: location, regulatory, market, consumer preference, real estate,
 * demographics. The first rule with any term contained in the lowercased query
 * wins.
 */
@Component
public class KeywordRuleTable {

    private static final List<IntentRule> RULES = List.of(
            new IntentRule(Intent.LOCATION_RECOMMENDER,
                    List.of("where", "location", "area", "place"),
                    Map.of(),
                    "Query appears to be about location recommendations"),
            new IntentRule(Intent.REGULATORY_ADVISOR,
                    List.of("license", "permit", "regulation", "legal", "compliance"),
                    Map.of("restaurant_type", "casual dining"),
                    "Query appears to be about regulatory requirements"),
            new IntentRule(Intent.MARKET_ANALYSIS,
                    List.of("market", "competition", "trend", "customer", "demographics", "profitable"),
                    Map.of("cuisine", "Multi-cuisine"),
                    "Query appears to be about market analysis"),
            new IntentRule(Intent.CONSUMER_SURVEY,
                    List.of("consumer", "preference", "survey", "dining habit", "behavior"),
                    Map.of("demographic", "all"),
                    "Query about consumer preferences and behavior"),
            new IntentRule(Intent.REAL_ESTATE,
                    List.of("rent", "real estate", "property", "commercial space", "lease"),
                    Map.of("locality", "downtown"),
                    "Query about real estate and property costs"),
            new IntentRule(Intent.DEMOGRAPHICS,
                    List.of("population", "demographics", "income", "economic", "gdp"),
                    Map.of(),
                    "Query about demographic and economic data"));

    /**
     * First rule matching the query, if any.
     */
    public Optional<IntentRule> match(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        return RULES.stream()
                .filter(rule -> rule.terms().stream().anyMatch(lower::contains))
                .findFirst();
    }

    /**
     * Default parameters of the rule for an intent; empty for intents without a
     * rule.
     */
    public Map<String, String> defaultsFor(Intent intent) {
        return RULES.stream()
                .filter(rule -> rule.intent() == intent)
                .map(IntentRule::defaults)
                .findFirst()
                .orElse(Map.of());
    }

    public List<IntentRule> rules() {
        return RULES;
    }

    /**
     * One row of the table.
     */
    public record IntentRule(Intent intent, List<String> terms, Map<String, String> defaults, String rationale) {
    }
}
