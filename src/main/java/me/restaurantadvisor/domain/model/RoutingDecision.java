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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of routing a single query: the chosen intent, the parameters
 * extracted from the query text, and a free-text rationale. Created once per
 * request and never mutated afterwards.
 */
@Value
@Builder(toBuilder = true)
public class RoutingDecision {

    Intent intent;

    @Builder.Default
    Map<String, String> parameters = Map.of();

    String rationale;

    /**
     * True when the decision came from the model-backed classifier, false when
     * the keyword rule cascade produced it.
     */
    boolean classified;

    public Optional<String> parameter(String name) {
        String value = parameters.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    /**
     * Returns a copy with the given parameters added where absent.
     */
    public RoutingDecision withMissingParameters(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(parameters);
        extra.forEach((key, value) -> {
            if (value != null && !value.isBlank() && parameter(key).isEmpty()) {
                merged.put(key, value);
            }
        });
        return toBuilder().parameters(Collections.unmodifiableMap(merged)).build();
    }

    public static RoutingDecision fallback(String rationale) {
        return RoutingDecision.builder()
                .intent(Intent.FALLBACK)
                .rationale(rationale)
                .build();
    }
}
