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

import me.restaurantadvisor.domain.model.AdvisorUser;
import me.restaurantadvisor.domain.model.ContextBundle;
import me.restaurantadvisor.domain.model.DataStore;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.RetrievedDocument;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.port.outbound.GraphReaderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Assembles the bounded evidence bundle for a routed intent.
 *
 * <p>
 * For each intent the aggregator derives a search query from the intent's
 * domain phrase and the parameters that are present, picks a category filter
 * and result count, and selects the graph lookups to run for the city. Each
 * store is consulted only if the caller's role may read it. A failing store
 * contributes an empty list; the bundle is always returned.
 *
 * <p>
 * The leading entries of both lists are also cached in the user's long-term
 * insight map under {@code context.<intent>}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextAggregator {

    public static final String INSIGHT_PREFIX = "context.";
    static final String CATEGORY_FIELD = "type";

    private static final int CACHED_DOCUMENTS = 2;
    private static final int CACHED_GRAPH_LINES = 3;
    private static final int SUMMARY_ITEM_COUNT = 3;

    private final HybridRetriever retriever;
    private final GraphReaderPort graphReader;
    private final GraphRecordFormatter formatter;
    private final AccessPolicyService accessPolicy;
    private final MemoryStore memoryStore;
    private final AdvisorProperties properties;

    /**
     * Builds the context bundle for one request. Never throws.
     *
     * @param intent
     *            effective intent after authorization
     * @param parameters
     *            parameters extracted by the router
     * @param user
     *            caller, used for store permissions and the insight cache
     * @param query
     *            raw query text, used by intents without a fixed domain phrase
     */
    public ContextBundle buildContext(Intent intent, Map<String, String> parameters, AdvisorUser user,
            String query) {
        Map<String, String> params = parameters != null ? parameters : Map.of();
        String role = user != null ? user.getRole() : null;
        SearchPlan plan = plan(intent, params, query);

        List<String> documents = List.of();
        List<String> provenance = List.of();
        if (accessPolicy.canRead(role, DataStore.KNOWLEDGE_BASE)) {
            List<RetrievedDocument> found = searchDocuments(plan);
            documents = found.stream().map(RetrievedDocument::getText).filter(Objects::nonNull).toList();
            provenance = distinctSources(found);
        } else {
            log.debug("[Context] Role '{}' may not read the knowledge base", role);
        }

        List<String> graphLines = List.of();
        if (accessPolicy.canRead(role, DataStore.KNOWLEDGE_GRAPH)) {
            graphLines = truncate(graphInsights(intent, params), properties.getRetrieval().getGraphContextLimit());
        } else {
            log.debug("[Context] Role '{}' may not read the knowledge graph", role);
        }

        ContextBundle bundle = ContextBundle.builder()
                .documents(documents)
                .graphInsights(graphLines)
                .provenance(provenance)
                .build();
        log.info("[Context] {}: {} document(s), {} graph line(s)", intent, documents.size(), graphLines.size());

        cacheInsights(user, intent, bundle);
        return bundle;
    }

    /**
     * Derived search query, category filter and result count for an intent.
     */
    SearchPlan plan(Intent intent, Map<String, String> params, String query) {
        AdvisorProperties.RetrievalProperties config = properties.getRetrieval();
        String city = params.get("city");
        return switch (intent) {
        case LOCATION_RECOMMENDER -> new SearchPlan(new DerivedQuery("restaurant locations")
                .with("in ", city, "")
                .with("", params.get("cuisine"), " cuisine")
                .with("", params.get("concept"), " restaurant concept")
                .with("for ", params.get("demographic"), " demographic")
                .keywords("commercial real estate market insights foot traffic")
                .build(), List.of("real_estate", "demographics", "food_consumption"), config.getDefaultTopK());
        case REGULATORY_ADVISOR -> new SearchPlan(new DerivedQuery("restaurant regulations")
                .with("in ", city, "")
                .with("", params.get("restaurant_type"), "")
                .keywords(isAffirmative(params.get("serves_alcohol"))
                        ? "liquor license alcohol serving requirements"
                        : null)
                .keywords("licensing permits requirements")
                .build(), List.of("regulation", "food_consumption"), config.getDefaultTopK());
        case MARKET_ANALYSIS -> new SearchPlan(new DerivedQuery("restaurant market analysis")
                .with("in ", city, "")
                .with("", params.get("cuisine"), " cuisine")
                .with("", params.get("concept"), " concept")
                .with("in ", params.get("area"), " area")
                .keywords("consumer trends competition demographics food preferences")
                .build(), List.of("food_consumption", "demographics", "real_estate"), config.getDefaultTopK());
        case CONSUMER_SURVEY -> new SearchPlan(new DerivedQuery("consumer dining preferences")
                .with("in ", city, "")
                .with("for ", params.get("demographic"), " demographic")
                .keywords("survey dining habits behavior")
                .build(), List.of("food_consumption", "demographics"), config.getDefaultTopK());
        case REAL_ESTATE -> new SearchPlan(new DerivedQuery("commercial real estate")
                .with("in ", city, "")
                .with("", params.get("locality"), "")
                .keywords("rent lease property commercial space")
                .build(), List.of("real_estate"), config.getDefaultTopK());
        case DEMOGRAPHICS -> new SearchPlan(new DerivedQuery("demographics")
                .with("of ", city, "")
                .keywords("population income economic profile")
                .build(), List.of("demographics"), config.getDefaultTopK());
        case PDF_RESEARCH -> new SearchPlan(new DerivedQuery("restaurant business research")
                .with("", params.get("research_topic"), "")
                .with("", params.get("specific_focus"), "")
                .with("in ", city, "")
                .keywords("studies reports findings data statistics")
                .build(), List.of("research", "food_consumption", "demographics", "real_estate"),
                config.getResearchTopK());
        case DOMAIN_SPECIALIST -> new SearchPlan(new DerivedQuery(query)
                .with("", params.get("domain_keywords"), "")
                .with("in ", city, "")
                .build(), List.of(), config.getDefaultTopK());
        case BASIC_QUERY -> new SearchPlan(query, List.of(), config.getBasicTopK());
        };
    }

    private List<RetrievedDocument> searchDocuments(SearchPlan plan) {
        try {
            Map<String, Object> filter = plan.categories().isEmpty()
                    ? Map.of()
                    : Map.of(CATEGORY_FIELD, plan.categories());
            return truncate(retriever.search(plan.query(), filter, plan.topK()), plan.topK());
        } catch (RuntimeException e) { // NOSONAR - retrieval failure degrades to no documents
            log.warn("[Context] Document retrieval FAILED: {}", e.getMessage());
            return List.of();
        }
    }

    private List<String> graphInsights(Intent intent, Map<String, String> params) {
        String city = params.get("city");
        if (city == null || city.isBlank()) {
            return List.of();
        }
        String cuisine = params.get("cuisine");
        List<String> lines = new ArrayList<>();
        switch (intent) {
        case LOCATION_RECOMMENDER -> lines.addAll(format(
                lookup("recommendLocations", () -> graphReader.recommendLocations(city, cuisine)),
                formatter::location));
        case REGULATORY_ADVISOR -> lines.addAll(format(
                lookup("regulations", () -> graphReader.regulations(city)),
                formatter::regulation));
        case MARKET_ANALYSIS -> {
            lines.addAll(format(lookup("cuisinePreferences", () -> graphReader.cuisinePreferences(city)),
                    formatter::cuisine));
            String area = params.get("area");
            if (area != null && !area.isBlank()) {
                lines.addAll(format(lookup("locationDetails", () -> graphReader.locationDetails(city, area)),
                        formatter::locationDetails));
            } else {
                lines.addAll(format(truncate(
                        lookup("recommendLocations", () -> graphReader.recommendLocations(city, null)),
                        SUMMARY_ITEM_COUNT), formatter::location));
            }
        }
        case CONSUMER_SURVEY -> lines.addAll(format(
                lookup("cuisinePreferences", () -> graphReader.cuisinePreferences(city)),
                formatter::cuisine));
        case REAL_ESTATE -> {
            String locality = params.get("locality");
            List<Map<String, Object>> details = locality != null && !locality.isBlank()
                    ? lookup("locationDetails", () -> graphReader.locationDetails(city, locality))
                    : List.of();
            if (!details.isEmpty()) {
                lines.addAll(format(details, formatter::locationDetails));
            } else {
                lines.addAll(format(lookup("recommendLocations", () -> graphReader.recommendLocations(city, null)),
                        formatter::location));
            }
        }
        case DEMOGRAPHICS -> lines.addAll(format(
                lookup("cityDemographics", () -> graphReader.cityDemographics(city)),
                formatter::demographics));
        case BASIC_QUERY -> lines.addAll(formatter.citySummary(city,
                lookup("regulations", () -> graphReader.regulations(city)).size(),
                truncate(lookup("recommendLocations", () -> graphReader.recommendLocations(city, null)),
                        SUMMARY_ITEM_COUNT),
                truncate(lookup("cuisinePreferences", () -> graphReader.cuisinePreferences(city)),
                        SUMMARY_ITEM_COUNT)));
        case PDF_RESEARCH, DOMAIN_SPECIALIST -> {
            lines.addAll(format(lookup("cityDemographics", () -> graphReader.cityDemographics(city)),
                    formatter::demographics));
            lines.addAll(format(lookup("cuisinePreferences", () -> graphReader.cuisinePreferences(city)),
                    formatter::cuisine));
        }
        default -> log.debug("[Context] No graph lookups for {}", intent);
        }
        return lines;
    }

    private List<Map<String, Object>> lookup(String name, Supplier<CompletableFuture<List<Map<String, Object>>>> call) {
        long timeoutMs = properties.getGraph().getTimeoutMs();
        try {
            List<Map<String, Object>> records = call.get().get(timeoutMs, TimeUnit.MILLISECONDS);
            return records != null ? records : List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[Context] Graph lookup '{}' FAILED: {}", name, cause.getMessage());
            return List.of();
        }
    }

    private List<String> format(List<Map<String, Object>> records, Function<Map<String, Object>, String> fn) {
        List<String> lines = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            try {
                lines.add(fn.apply(record));
            } catch (RuntimeException e) { // NOSONAR - skip malformed record
                log.debug("[Context] Skipping malformed graph record: {}", e.getMessage());
            }
        }
        return lines;
    }

    private void cacheInsights(AdvisorUser user, Intent intent, ContextBundle bundle) {
        if (user == null || user.getId() == null || bundle.isEmpty()) {
            return;
        }
        Map<String, Object> insight = new LinkedHashMap<>();
        insight.put("documents", truncate(bundle.getDocuments(), CACHED_DOCUMENTS));
        insight.put("graph", truncate(bundle.getGraphInsights(), CACHED_GRAPH_LINES));
        try {
            memoryStore.putInsight(user.getId(), INSIGHT_PREFIX + intent.getWireName(), insight);
        } catch (RuntimeException e) { // NOSONAR - caching is best effort
            log.warn("[Context] Failed to cache insights for {}: {}", user.getId(), e.getMessage());
        }
    }

    private static List<String> distinctSources(List<RetrievedDocument> documents) {
        Set<String> sources = new LinkedHashSet<>();
        for (RetrievedDocument doc : documents) {
            if (!doc.getSource().isBlank()) {
                sources.add(doc.getSource());
            }
        }
        return List.copyOf(sources);
    }

    private static boolean isAffirmative(String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("yes") || normalized.equals("true") || normalized.equals("y");
    }

    private static <T> List<T> truncate(List<T> values, int limit) {
        return values.size() <= limit ? List.copyOf(values) : List.copyOf(values.subList(0, limit));
    }

    record SearchPlan(String query, List<String> categories, int topK) {
    }

    /**
     * Space-joined query phrase where absent parameters leave no trace.
     */
    static final class DerivedQuery {
        private final StringBuilder sb;

        DerivedQuery(String base) {
            this.sb = new StringBuilder(base != null ? base.trim() : "");
        }

        DerivedQuery with(String prefix, String value, String suffix) {
            if (value != null && !value.isBlank()) {
                append(prefix + value.trim() + suffix);
            }
            return this;
        }

        DerivedQuery keywords(String keywords) {
            if (keywords != null && !keywords.isBlank()) {
                append(keywords);
            }
            return this;
        }

        String build() {
            return sb.toString();
        }

        private void append(String part) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(part);
        }
    }
}
