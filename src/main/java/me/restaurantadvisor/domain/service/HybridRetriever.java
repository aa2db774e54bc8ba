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

import me.restaurantadvisor.domain.model.RetrievedDocument;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.port.outbound.DocumentSearchPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Hybrid document retrieval: fuses a keyword-ranked and a semantic-ranked list
 * from the document store into one re-ranked result.
 *
 * <p>
 * Algorithm:
 * <ol>
 * <li>Issue both searches concurrently, each for {@code 2k} candidates</li>
 * <li>Score every document by position in each list: {@code 1 - rank/size},
 * and 0 for a list that does not contain it</li>
 * <li>Combine as {@code keyword * (1 - α) + semantic * α}</li>
 * <li>Sort by combined score (stable, first-seen order on ties) and keep
 * {@code k}</li>
 * </ol>
 *
 * <p>
 * Documents are matched across lists by {@link RetrievedDocument#fusionKey()}.
 * When either search fails or times out the keyword ranking alone is returned,
 * or an empty list if the keyword search itself failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridRetriever {

    private final DocumentSearchPort documentSearch;
    private final AdvisorProperties properties;

    public List<RetrievedDocument> search(String query, Map<String, Object> filter, int k) {
        return search(query, filter, k, properties.getRetrieval().getFusionWeight());
    }

    public List<RetrievedDocument> search(String query, Map<String, Object> filter, int k, double alpha) {
        if (k <= 0 || query == null || query.isBlank()) {
            return List.of();
        }
        Map<String, Object> safeFilter = filter != null ? filter : Map.of();
        int candidates = k * 2;
        long timeoutMs = properties.getRetrieval().getTimeoutMs();

        CompletableFuture<List<RetrievedDocument>> keywordFuture = start(
                () -> documentSearch.keywordSearch(query, safeFilter, candidates));
        CompletableFuture<List<RetrievedDocument>> semanticFuture = start(
                () -> documentSearch.semanticSearch(query, safeFilter, candidates));

        List<RetrievedDocument> keyword;
        try {
            keyword = await(keywordFuture, timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            semanticFuture.cancel(true);
            return List.of();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Retriever] Keyword search FAILED, returning no documents: {}", describe(e));
            semanticFuture.cancel(true);
            return List.of();
        }

        List<RetrievedDocument> semantic;
        try {
            semantic = await(semanticFuture, timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return truncate(keyword, k);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Retriever] Semantic search FAILED, using keyword ranking: {}", describe(e));
            return truncate(keyword, k);
        }

        List<RetrievedDocument> fused = fuse(keyword, semantic, k, alpha);
        log.debug("[Retriever] Fused {} keyword + {} semantic candidates into {} results (alpha={})",
                keyword.size(), semantic.size(), fused.size(), alpha);
        return fused;
    }

    /**
     * Positional score fusion of two ranked lists.
     */
    static List<RetrievedDocument> fuse(List<RetrievedDocument> keyword, List<RetrievedDocument> semantic,
            int k, double alpha) {
        Map<String, ScoredDocument> scored = new LinkedHashMap<>();

        for (int i = 0; i < keyword.size(); i++) {
            RetrievedDocument doc = keyword.get(i);
            double score = positionalScore(i, keyword.size());
            scored.computeIfAbsent(doc.fusionKey(), key -> new ScoredDocument(doc)).keywordScore(score);
        }
        for (int i = 0; i < semantic.size(); i++) {
            RetrievedDocument doc = semantic.get(i);
            double score = positionalScore(i, semantic.size());
            scored.computeIfAbsent(doc.fusionKey(), key -> new ScoredDocument(doc)).semanticScore(score);
        }

        List<ScoredDocument> ranked = new ArrayList<>(scored.values());
        ranked.sort(Comparator.comparingDouble((ScoredDocument s) -> s.combined(alpha)).reversed());

        return ranked.stream()
                .limit(k)
                .map(ScoredDocument::document)
                .toList();
    }

    private static double positionalScore(int rank, int size) {
        return 1.0 - ((double) rank / size);
    }

    private CompletableFuture<List<RetrievedDocument>> start(
            Supplier<CompletableFuture<List<RetrievedDocument>>> call) {
        try {
            CompletableFuture<List<RetrievedDocument>> future = call.get();
            return future != null ? future : CompletableFuture.completedFuture(List.of());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private List<RetrievedDocument> await(CompletableFuture<List<RetrievedDocument>> future, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        List<RetrievedDocument> result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        return result != null ? result : List.of();
    }

    private static List<RetrievedDocument> truncate(List<RetrievedDocument> documents, int k) {
        return documents.size() <= k ? documents : List.copyOf(documents.subList(0, k));
    }

    private static String describe(Exception e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static final class ScoredDocument {
        private final RetrievedDocument document;
        private double keywordScore;
        private double semanticScore;
        private boolean keywordSeen;
        private boolean semanticSeen;

        ScoredDocument(RetrievedDocument document) {
            this.document = document;
        }

        void keywordScore(double score) {
            if (!keywordSeen) {
                keywordScore = score;
                keywordSeen = true;
            }
        }

        void semanticScore(double score) {
            if (!semanticSeen) {
                semanticScore = score;
                semanticSeen = true;
            }
        }

        double combined(double alpha) {
            return keywordScore * (1 - alpha) + semanticScore * alpha;
        }

        RetrievedDocument document() {
            return document;
        }
    }
}
