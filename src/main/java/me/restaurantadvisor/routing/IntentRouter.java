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
import me.restaurantadvisor.domain.model.RoutingDecision;
import me.restaurantadvisor.domain.model.SpecialistDomain;
import me.restaurantadvisor.domain.service.CityGazetteer;
import me.restaurantadvisor.domain.service.PreferenceExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a raw query to an intent and its parameters.
 *
 * <p>
 * Routing runs in two tiers:
 * <ol>
 * <li><b>Classifier</b> - the LLM classifier, when enabled and available</li>
 * <li><b>Keyword rules</b> - the ordered {@link KeywordRuleTable} cascade,
 * defaulting to {@code basic_query}</li>
 * </ol>
 * Whichever tier answers, the decision is then completed the same way: a city
 * named in the query is injected when none was extracted, known user
 * preferences fill city and cuisine for location and market intents, and the
 * rule table's default parameters fill what is still missing.
 *
 * <p>
 * {@link #route(String, Map)} never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentRouter {

    static final String DOMAIN_KEYWORDS = "domain_keywords";

    private static final Set<Intent> PREFERENCE_ENRICHED = Set.of(Intent.LOCATION_RECOMMENDER,
            Intent.MARKET_ANALYSIS);
    private static final List<String> ENRICHED_KEYS = List.of(PreferenceExtractor.CITY,
            PreferenceExtractor.CUISINE);

    private final LlmIntentClassifier classifier;
    private final KeywordRuleTable ruleTable;
    private final CityGazetteer gazetteer;

    public RoutingDecision route(String query) {
        return route(query, Map.of());
    }

    /**
     * Routes a query.
     *
     * @param query
     *            the user's query text
     * @param knownPreferences
     *            long-term preferences of the user, may be empty
     * @return the routing decision, never {@code null}
     */
    public RoutingDecision route(String query, Map<String, String> knownPreferences) {
        if (query == null || query.isBlank()) {
            return RoutingDecision.fallback("Empty query routed to general assistance");
        }
        try {
            RoutingDecision decision = classify(query).orElseGet(() -> matchRules(query));
            RoutingDecision completed = complete(decision, query,
                    knownPreferences != null ? knownPreferences : Map.of());
            log.info("[Router] Routed to {} ({}), parameters={}", completed.getIntent(),
                    completed.isClassified() ? "classifier" : "keyword rules", completed.getParameters());
            return completed;
        } catch (RuntimeException e) { // NOSONAR - routing must always yield a decision
            log.error("[Router] Routing FAILED, using fallback: {}", e.getMessage(), e);
            return RoutingDecision.fallback("Routing failed (" + e.getMessage() + "), using general assistance");
        }
    }

    private Optional<RoutingDecision> classify(String query) {
        if (!classifier.isAvailable()) {
            log.debug("[Router] Classifier unavailable, using keyword rules");
            return Optional.empty();
        }
        return classifier.classify(query)
                .map(result -> RoutingDecision.builder()
                        .intent(result.intent())
                        .parameters(result.parameters())
                        .rationale(result.reasoning())
                        .classified(true)
                        .build());
    }

    RoutingDecision matchRules(String query) {
        return ruleTable.match(query)
                .map(rule -> RoutingDecision.builder()
                        .intent(rule.intent())
                        .rationale(rule.rationale())
                        .build())
                .orElseGet(() -> RoutingDecision.fallback("General query about restaurants"));
    }

    private RoutingDecision complete(RoutingDecision decision, String query, Map<String, String> preferences) {
        RoutingDecision result = decision;

        if (result.parameter(PreferenceExtractor.CITY).isEmpty()) {
            Optional<String> city = gazetteer.findFirst(query);
            if (city.isPresent()) {
                result = result.withMissingParameters(Map.of(PreferenceExtractor.CITY, city.get()));
            }
        }

        if (PREFERENCE_ENRICHED.contains(result.getIntent())) {
            Map<String, String> known = new LinkedHashMap<>();
            for (String key : ENRICHED_KEYS) {
                String value = preferences.get(key);
                if (value != null) {
                    known.put(key, value);
                }
            }
            result = result.withMissingParameters(known);
        }

        result = result.withMissingParameters(ruleTable.defaultsFor(result.getIntent()));

        if (result.getIntent() == Intent.DOMAIN_SPECIALIST && result.parameter(DOMAIN_KEYWORDS).isEmpty()) {
            Optional<SpecialistDomain> domain = SpecialistDomain.select(query, result.getParameters());
            if (domain.isPresent()) {
                List<String> terms = domain.get().matchedTerms(query);
                if (!terms.isEmpty()) {
                    result = result.withMissingParameters(Map.of(DOMAIN_KEYWORDS, String.join(" ", terms)));
                }
            }
        }
        return result;
    }
}
