package me.restaurantadvisor.port.outbound;

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

import me.restaurantadvisor.domain.model.RetrievedDocument;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the two ranked search capabilities of the document store. Both
 * return documents best-first.
 *
 * <p>
 * Filter entries restrict metadata fields: a collection value means "one of",
 * any other value means equality.
 */
public interface DocumentSearchPort {

    CompletableFuture<List<RetrievedDocument>> keywordSearch(String query, Map<String, Object> filter, int limit);

    CompletableFuture<List<RetrievedDocument>> semanticSearch(String query, Map<String, Object> filter, int limit);
}
