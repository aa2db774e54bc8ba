package me.restaurantadvisor.adapter.outbound.knowledge;

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
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.port.outbound.DocumentSearchPort;
import me.restaurantadvisor.port.outbound.EmbeddingPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.TextCriteria;
import org.springframework.data.mongodb.core.query.TextQuery;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Knowledge base search over a MongoDB collection.
 *
 * <p>
 * Keyword search uses the collection's text index sorted by text score;
 * semantic search runs an Atlas {@code $vectorSearch} aggregation with the
 * query embedded by {@link EmbeddingPort}. Filter keys are metadata field
 * names; a collection value matches any of its elements.
 *
 * <p>
 * Expected document shape:
 *
 * <pre>
 * { "content": "...", "embedding": [...], "metadata": { "type": "regulation", "source": "..." } }
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoDocumentSearchAdapter implements DocumentSearchPort {

    private static final String METADATA_FIELD = "metadata";

    private final MongoTemplate mongoTemplate;
    private final EmbeddingPort embeddingPort;
    private final AdvisorProperties properties;

    @Override
    public CompletableFuture<List<RetrievedDocument>> keywordSearch(String query, Map<String, Object> filter,
            int limit) {
        return CompletableFuture.supplyAsync(() -> {
            AdvisorProperties.MongoProperties config = properties.getRetrieval().getMongo();
            Query textQuery = TextQuery.queryText(TextCriteria.forDefaultLanguage().matching(query))
                    .sortByScore()
                    .limit(limit);
            for (Map.Entry<String, Object> entry : filter.entrySet()) {
                textQuery.addCriteria(criteria(config.getMetadataPrefix() + entry.getKey(), entry.getValue()));
            }
            List<Document> results = mongoTemplate.find(textQuery, Document.class, config.getCollection());
            log.debug("[Mongo] Keyword search returned {} document(s)", results.size());
            return results.stream().map(this::toRetrievedDocument).toList();
        });
    }

    @Override
    public CompletableFuture<List<RetrievedDocument>> semanticSearch(String query, Map<String, Object> filter,
            int limit) {
        if (!embeddingPort.isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Embedding service unavailable"));
        }
        return embeddingPort.embed(query).thenApply(vector -> {
            AdvisorProperties.MongoProperties config = properties.getRetrieval().getMongo();
            List<Document> pipeline = List.of(
                    new Document("$vectorSearch", vectorSearchStage(config, vector, filter, limit)),
                    new Document("$project", new Document(config.getEmbeddingField(), 0)));
            List<Document> results = mongoTemplate.getCollection(config.getCollection())
                    .aggregate(pipeline)
                    .into(new ArrayList<>());
            log.debug("[Mongo] Vector search returned {} document(s)", results.size());
            return results.stream().map(this::toRetrievedDocument).toList();
        });
    }

    Document vectorSearchStage(AdvisorProperties.MongoProperties config, float[] vector,
            Map<String, Object> filter, int limit) {
        List<Double> queryVector = new ArrayList<>(vector.length);
        for (float v : vector) {
            queryVector.add((double) v);
        }
        Document stage = new Document("index", config.getVectorIndex())
                .append("path", config.getEmbeddingField())
                .append("queryVector", queryVector)
                .append("numCandidates", limit * config.getCandidateMultiplier())
                .append("limit", limit);
        if (!filter.isEmpty()) {
            Document filterDoc = new Document();
            filter.forEach((key, value) -> filterDoc.append(config.getMetadataPrefix() + key,
                    value instanceof Collection<?> values ? new Document("$in", new ArrayList<>(values)) : value));
            stage.append("filter", filterDoc);
        }
        return stage;
    }

    RetrievedDocument toRetrievedDocument(Document document) {
        AdvisorProperties.MongoProperties config = properties.getRetrieval().getMongo();
        Object content = document.get(config.getContentField());
        Map<String, Object> metadata = new LinkedHashMap<>();
        Object raw = document.get(METADATA_FIELD);
        if (raw instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                if (key != null && value != null) {
                    metadata.put(key.toString(), value);
                }
            });
        }
        return RetrievedDocument.builder()
                .text(content != null ? content.toString() : "")
                .metadata(metadata)
                .build();
    }

    private static Criteria criteria(String field, Object value) {
        if (value instanceof Collection<?> values) {
            return Criteria.where(field).in(values);
        }
        return Criteria.where(field).is(value);
    }
}
