package me.restaurantadvisor.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the advisor, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code advisor.*} prefix with nested
 * property classes per subsystem:
 * <ul>
 * <li>{@link LlmProperties} - chat model provider settings</li>
 * <li>{@link RouterProperties} - query classification</li>
 * <li>{@link RetrievalProperties} - hybrid document search and context
 * bounds</li>
 * <li>{@link GraphProperties} - Neo4j connection</li>
 * <li>{@link MemoryProperties} - conversational memory and eviction</li>
 * <li>{@link AccessProperties} - role based access policy table</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "advisor")
@Data
public class AdvisorProperties {

    private LlmProperties llm = new LlmProperties();
    private RouterProperties router = new RouterProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private GraphProperties graph = new GraphProperties();
    private MemoryProperties memory = new MemoryProperties();
    private StorageProperties storage = new StorageProperties();
    private HandlerProperties handlers = new HandlerProperties();
    private AccessProperties access = new AccessProperties();

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private long timeoutMs = 60000;
        private int maxRetries = 3;
        private long initialBackoffMs = 2000;
    }

    @Data
    public static class RouterProperties {
        private boolean classifierEnabled = true;
        private String classifierModel;
        private long classifierTimeoutMs = 10000;
    }

    @Data
    public static class RetrievalProperties {
        private double fusionWeight = 0.5;
        private int defaultTopK = 5;
        private int researchTopK = 8;
        private int basicTopK = 3;
        private int graphContextLimit = 8;
        private long timeoutMs = 10000;
        private String embeddingModel = "text-embedding-3-small";
        private MongoProperties mongo = new MongoProperties();
    }

    @Data
    public static class MongoProperties {
        private String collection = "restaurant_knowledge";
        private String contentField = "content";
        private String metadataPrefix = "metadata.";
        private String vectorIndex = "vector_index";
        private String embeddingField = "embedding";
        private int candidateMultiplier = 10;
    }

    @Data
    public static class GraphProperties {
        private String uri = "bolt://localhost:7687";
        private String username = "neo4j";
        private String password = "";
        private String database;
        private long timeoutMs = 10000;
        private double minLocationScore = 0.5;
        private int locationLimit = 10;
    }

    @Data
    public static class MemoryProperties {
        private int shortTermCapacity = 10;
        private int recentQueryCapacity = 20;
        private long sessionTimeoutSeconds = 3600;
        private long evictionIntervalMs = 60000;
        private boolean persistenceEnabled = true;
        private String file = "user-memory.json";
        private int relevantItemLimit = 5;
        private int contextQueryCount = 3;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.restaurant-advisor/workspace";
    }

    @Data
    public static class HandlerProperties {
        private long timeoutMs = 60000;
    }

    @Data
    public static class AccessProperties {
        private Map<String, RolePolicy> roles = new LinkedHashMap<>();
    }

    /**
     * Permissions of one role. The literal {@code all} in any list grants every
     * value of that kind.
     */
    @Data
    public static class RolePolicy {
        private List<String> intents = new ArrayList<>();
        private List<String> domains = new ArrayList<>();
        private List<String> knowledgeBase = new ArrayList<>();
        private List<String> knowledgeGraph = new ArrayList<>();
        private List<String> memory = new ArrayList<>();
    }
}
