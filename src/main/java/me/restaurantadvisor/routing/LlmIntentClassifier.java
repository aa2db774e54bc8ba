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
import me.restaurantadvisor.domain.model.LlmRequest;
import me.restaurantadvisor.domain.model.LlmResponse;
import me.restaurantadvisor.domain.model.Message;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.port.outbound.LlmPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM-based query classifier for the advisor intents.
 *
 * <p>
 * The model is asked for a JSON object
 * {@code {"agent": ..., "parameters": {...}, "reasoning": ...}}. The reply is
 * often wrapped in prose or markdown fences, so the first JSON object is
 * located before parsing: a fenced block first, then the first balanced
 * {@code {...}} span, then the whole reply.
 *
 * <p>
 * Any failure (provider unavailable, timeout, unparsable reply, unknown
 * intent) yields an empty result; the router then falls back to the keyword
 * rule cascade.
 *
 * @since 1.0
 * @see IntentRouter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmIntentClassifier {

    private final AdvisorProperties properties;
    private final ObjectMapper objectMapper;
    private final LlmPort llmPort;

    private static final Pattern JSON_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private static final String SYSTEM_PROMPT = """
            You are a query classifier for a restaurant advisory system in India.
            Analyze the user query and determine which specialized agent should handle it.

            Available agents:
            - location_recommender: Where to locate restaurants, best areas, location analysis
            - regulatory_advisor: Licenses, permits, legal compliance, regulations
            - market_analysis: Market potential, competition, trends
            - consumer_survey: Consumer preferences, dining habits, survey results
            - real_estate: Rent, leases, commercial property
            - demographics: Population, income, economic profile of a city
            - pdf_research: Research findings, reports, studies about restaurants
            - domain_specialist: Cuisine, finance, staffing, marketing, technology or interior design questions
            - basic_query: General questions not fitting above categories

            Extract parameters based on agent:
            - location_recommender: concept, cuisine, demographic, budget, city
            - regulatory_advisor: city, restaurant_type, serves_alcohol, seating_capacity
            - market_analysis: concept, cuisine, city, area, demographic
            - consumer_survey: city, demographic
            - real_estate: city, locality
            - pdf_research: research_topic, specific_focus, city
            Omit parameters that are not mentioned in the query.

            Respond ONLY with a JSON object:
            {"agent": "agent_name", "parameters": {"city": "value"}, "reasoning": "brief explanation"}
            """;

    /**
     * Whether a classification attempt makes sense at all.
     */
    public boolean isAvailable() {
        return properties.getRouter().isClassifierEnabled() && llmPort.isAvailable();
    }

    /**
     * Classify the query.
     *
     * @param query
     *            the user's query text
     * @return the classification, or empty if it failed for any reason
     */
    public Optional<ClassificationResult> classify(String query) {
        AdvisorProperties.RouterProperties config = properties.getRouter();
        try {
            LlmRequest request = LlmRequest.builder()
                    .model(config.getClassifierModel() != null ? config.getClassifierModel()
                            : properties.getLlm().getModel())
                    .systemPrompt(SYSTEM_PROMPT)
                    .messages(List.of(Message.builder()
                            .role(Message.ROLE_USER)
                            .content("User query: " + query)
                            .build()))
                    .temperature(0.0)
                    .build();

            log.debug("[Classifier] Sending request to LLM (timeout: {}ms)...", config.getClassifierTimeoutMs());
            long startMs = System.currentTimeMillis();
            LlmResponse response = llmPort.chat(request)
                    .get(config.getClassifierTimeoutMs(), TimeUnit.MILLISECONDS);
            log.debug("[Classifier] LLM responded in {}ms", System.currentTimeMillis() - startMs);

            Optional<ClassificationResult> result = parseResponse(response != null ? response.getContent() : null);
            result.ifPresent(r -> log.info("[Classifier] Parsed result: intent={}, parameters={}",
                    r.intent(), r.parameters()));
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Classifier] Interrupted while waiting for classification");
            return Optional.empty();
        } catch (Exception e) { // NOSONAR - any classifier failure falls back to keyword rules
            log.warn("[Classifier] LLM classification FAILED: {}", e.getMessage());
            return Optional.empty();
        }
    }

    Optional<ClassificationResult> parseResponse(String response) {
        if (response == null || response.isBlank()) {
            log.warn("[Classifier] Empty classifier response");
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(extractJson(response));
            if (node == null || !node.isObject()) {
                log.warn("[Classifier] Classifier response is not a JSON object");
                return Optional.empty();
            }

            String agent = node.hasNonNull("agent") ? node.get("agent").asText() : null;
            if (agent == null && node.hasNonNull("intent")) {
                agent = node.get("intent").asText();
            }
            Optional<Intent> intent = agent != null ? Intent.fromName(agent) : Optional.of(Intent.FALLBACK);
            if (intent.isEmpty()) {
                log.warn("[Classifier] LLM returned unknown intent: {}", agent);
                return Optional.empty();
            }

            Map<String, String> parameters = new LinkedHashMap<>();
            JsonNode params = node.get("parameters");
            if (params != null && params.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    String value = parameterValue(field.getValue());
                    if (value != null && !value.isBlank()) {
                        parameters.put(field.getKey(), value.trim());
                    }
                }
            }

            String reasoning = node.hasNonNull("reasoning") ? node.get("reasoning").asText()
                    : "Query processed by routing classifier";
            return Optional.of(new ClassificationResult(intent.get(), parameters, reasoning));

        } catch (Exception e) { // NOSONAR
            log.warn("[Classifier] Failed to parse LLM response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String extractJson(String response) {
        Matcher mdMatcher = JSON_PATTERN.matcher(response);
        if (mdMatcher.find()) {
            return mdMatcher.group(1);
        }

        String balanced = firstBalancedObject(response);
        if (balanced != null) {
            return balanced;
        }

        return response.trim();
    }

    /**
     * First {@code {...}} span with balanced braces, ignoring braces inside
     * string literals.
     */
    private static String firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                } else if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    private static String parameterValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode item : value) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(item.asText());
            }
            return sb.toString();
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    /**
     * Result of LLM classification.
     */
    public record ClassificationResult(
            Intent intent,
            Map<String, String> parameters,
            String reasoning) {
    }
}
