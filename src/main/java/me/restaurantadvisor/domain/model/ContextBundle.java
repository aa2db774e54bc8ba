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

/**
 * Bounded evidence handed to an intent handler: document snippets, formatted
 * graph lines and the source identifiers of the documents.
 */
@Value
@Builder
public class ContextBundle {

    @Builder.Default
    List<String> documents = List.of();

    @Builder.Default
    List<String> graphInsights = List.of();

    @Builder.Default
    List<String> provenance = List.of();

    public boolean isEmpty() {
        return documents.isEmpty() && graphInsights.isEmpty();
    }

    public static ContextBundle empty() {
        return ContextBundle.builder().build();
    }
}
