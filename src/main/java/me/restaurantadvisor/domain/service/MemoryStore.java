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

import me.restaurantadvisor.domain.model.LongTermMemory;
import me.restaurantadvisor.domain.model.MemoryRecord;
import me.restaurantadvisor.domain.model.Message;
import me.restaurantadvisor.domain.model.ShortTermMemory;
import me.restaurantadvisor.domain.model.UserContext;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties.MemoryProperties;
import me.restaurantadvisor.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Per-user conversational memory: short-term message window, long-term
 * facts/preferences/queries/insights and session scratch data.
 *
 * <p>
 * Records live in a concurrent map keyed by user id and are created lazily on
 * first interaction. Every mutation of a record happens while holding that
 * record's monitor; the eviction sweep takes the same monitor before removing
 * a record and marks it evicted, so a writer holding a stale reference retries
 * against a fresh record instead of writing into a discarded one.
 *
 * <p>
 * State is restored from storage at startup and written back on shutdown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryStore {

    private static final String MEMORY_DIR = "memory";

    private final AdvisorProperties properties;
    private final PreferenceExtractor preferenceExtractor;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, MemoryRecord> records = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadAtStartup() {
        if (properties.getMemory().isPersistenceEnabled()) {
            load();
        }
    }

    @PreDestroy
    public void saveOnShutdown() {
        if (properties.getMemory().isPersistenceEnabled()) {
            save();
        }
    }

    /**
     * Returns the user's record, creating it if needed, and refreshes its
     * last-activity timestamp.
     */
    public MemoryRecord touch(String userId) {
        return withRecord(userId, record -> record);
    }

    /**
     * Appends a message to the short-term window. User messages are also added
     * to the recent-query history.
     */
    public void append(String userId, Message message) {
        MemoryProperties config = config();
        withRecord(userId, record -> {
            Instant now = clock.instant();
            Message stamped = message.getTimestamp() != null ? message
                    : Message.builder().role(message.getRole()).content(message.getContent()).timestamp(now).build();
            record.getShortTerm().add(stamped, config.getShortTermCapacity(), now);
            if (stamped.isUserMessage() && stamped.getContent() != null) {
                record.getLongTerm().addQuery(stamped.getContent(), config.getRecentQueryCapacity());
            }
            return null;
        });
    }

    /**
     * Scans the text for known cuisine, city and budget keywords and overwrites
     * the matching long-term preferences.
     *
     * @return the preferences that were written
     */
    public Map<String, String> extractAndMergePreferences(String userId, String messageText) {
        Map<String, String> extracted = preferenceExtractor.extract(messageText);
        if (extracted.isEmpty()) {
            touch(userId);
            return extracted;
        }
        withRecord(userId, record -> {
            extracted.forEach(record.getLongTerm()::putPreference);
            return null;
        });
        log.debug("[Memory] Merged preferences for {}: {}", userId, extracted);
        return extracted;
    }

    public boolean rememberFact(String userId, String fact) {
        return withRecord(userId, record -> record.getLongTerm().addFact(fact));
    }

    public void putInsight(String userId, String key, Object insight) {
        withRecord(userId, record -> {
            record.getLongTerm().putInsight(key, insight);
            return null;
        });
    }

    public void putSessionValue(String userId, String key, Object value) {
        withRecord(userId, record -> {
            record.getSession().put(key, value);
            return null;
        });
    }

    public Optional<Object> getSessionValue(String userId, String key) {
        return read(userId, record -> record.getSession().get(key));
    }

    /**
     * Clears the user's session scratch data, e.g. on logout.
     */
    public void clearSession(String userId) {
        MemoryRecord record = records.get(userId);
        if (record == null) {
            return;
        }
        synchronized (record) {
            record.getSession().clear();
            record.setLastActivity(clock.instant());
        }
        log.info("[Memory] Cleared session data for {}", userId);
    }

    public List<Message> messages(String userId) {
        return read(userId, record -> List.copyOf(record.getShortTerm().getMessages())).orElse(List.of());
    }

    public Map<String, String> preferences(String userId) {
        return read(userId, record -> Map.copyOf(record.getLongTerm().getPreferences())).orElse(Map.of());
    }

    public List<String> facts(String userId) {
        return read(userId, record -> List.copyOf(record.getLongTerm().getFacts())).orElse(List.of());
    }

    public boolean contains(String userId) {
        return records.containsKey(userId);
    }

    public int size() {
        return records.size();
    }

    /**
     * Digest of the user's memory for handler prompts: all preferences, the
     * last few queries, and the facts and insights whose text overlaps with
     * the query.
     */
    public UserContext userContext(String userId, String query) {
        MemoryProperties config = config();
        return read(userId, record -> {
            LongTermMemory longTerm = record.getLongTerm();
            String queryLower = query != null ? query.toLowerCase(Locale.ROOT) : "";
            List<String> words = queryLower.isBlank() ? List.of() : List.of(queryLower.split("\\s+"));

            List<String> facts = new ArrayList<>();
            for (String fact : longTerm.getFacts()) {
                String factLower = fact.toLowerCase(Locale.ROOT);
                if (words.stream().anyMatch(factLower::contains)) {
                    facts.add(fact);
                    if (facts.size() >= config.getRelevantItemLimit()) {
                        break;
                    }
                }
            }

            Map<String, Object> insights = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : longTerm.getInsights().entrySet()) {
                if (!queryLower.isBlank() && queryLower.contains(insightTopic(entry.getKey()))) {
                    insights.put(entry.getKey(), entry.getValue());
                    if (insights.size() >= config.getRelevantItemLimit()) {
                        break;
                    }
                }
            }

            return UserContext.builder()
                    .preferences(Map.copyOf(longTerm.getPreferences()))
                    .recentQueries(longTerm.lastQueries(config.getContextQueryCount()))
                    .facts(List.copyOf(facts))
                    .insights(insights)
                    .session(new LinkedHashMap<>(record.getSession()))
                    .build();
        }).orElseGet(() -> UserContext.builder().build());
    }

    /**
     * Removes every record whose last activity is older than the configured
     * session timeout.
     *
     * @return number of evicted records
     */
    public int evict() {
        Instant cutoff = clock.instant().minus(Duration.ofSeconds(config().getSessionTimeoutSeconds()));
        int evicted = 0;
        Iterator<Map.Entry<String, MemoryRecord>> it = records.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, MemoryRecord> entry = it.next();
            MemoryRecord record = entry.getValue();
            synchronized (record) {
                Instant lastActivity = record.getLastActivity();
                if (lastActivity != null && lastActivity.isBefore(cutoff)) {
                    record.setEvicted(true);
                    records.remove(entry.getKey(), record);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("[Memory] Evicted {} inactive user record(s)", evicted);
        }
        return evicted;
    }

    @Scheduled(fixedDelayString = "${advisor.memory.eviction-interval-ms:60000}")
    public void scheduledEviction() {
        try {
            if (evict() > 0 && config().isPersistenceEnabled()) {
                save();
            }
        } catch (RuntimeException e) { // NOSONAR - background sweep must keep running
            log.error("[Memory] Eviction sweep failed", e);
        }
    }

    /**
     * Serializes every record to a JSON object keyed by user id.
     */
    public String serialize() {
        ObjectNode root = objectMapper.createObjectNode();
        for (Map.Entry<String, MemoryRecord> entry : records.entrySet()) {
            MemoryRecord record = entry.getValue();
            synchronized (record) {
                root.set(entry.getKey(), objectMapper.valueToTree(record));
            }
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize memory", e);
        }
    }

    /**
     * Replaces the in-memory state with the records contained in the JSON
     * produced by {@link #serialize()}.
     *
     * @return number of restored records
     */
    public int deserialize(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed memory data", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Memory data must be a JSON object keyed by user id");
        }

        Map<String, MemoryRecord> restored = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                MemoryRecord record = objectMapper.treeToValue(field.getValue(), MemoryRecord.class);
                restored.put(field.getKey(), normalize(field.getKey(), record));
            } catch (JsonProcessingException e) {
                log.warn("[Memory] Skipping unreadable record for {}: {}", field.getKey(), e.getMessage());
            }
        }

        records.clear();
        records.putAll(restored);
        return restored.size();
    }

    /**
     * Writes the serialized state to the memory file.
     */
    public void save() {
        String file = config().getFile();
        try {
            storagePort.putTextAtomic(MEMORY_DIR, file, serialize(), true).join();
            log.info("[Memory] Saved {} user record(s) to {}/{}", records.size(), MEMORY_DIR, file);
        } catch (RuntimeException e) { // NOSONAR - persistence failure must not break shutdown
            log.error("[Memory] Failed to save memory to {}/{}", MEMORY_DIR, file, e);
        }
    }

    /**
     * Restores state from the memory file if it exists.
     */
    public void load() {
        String file = config().getFile();
        try {
            if (!Boolean.TRUE.equals(storagePort.exists(MEMORY_DIR, file).join())) {
                log.info("[Memory] No persisted memory found at {}/{}", MEMORY_DIR, file);
                return;
            }
            String json = storagePort.getText(MEMORY_DIR, file).join();
            if (json == null || json.isBlank()) {
                log.info("[Memory] No persisted memory found at {}/{}", MEMORY_DIR, file);
                return;
            }
            int count = deserialize(json);
            log.info("[Memory] Restored {} user record(s) from {}/{}", count, MEMORY_DIR, file);
        } catch (RuntimeException e) { // NOSONAR - start with empty memory on corrupt file
            log.warn("[Memory] Failed to load memory from {}/{}: {}", MEMORY_DIR, file, e.getMessage());
        }
    }

    private <T> T withRecord(String userId, Function<MemoryRecord, T> mutation) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        while (true) {
            MemoryRecord record = records.computeIfAbsent(userId, this::newRecord);
            synchronized (record) {
                if (record.isEvicted()) {
                    continue;
                }
                T result = mutation.apply(record);
                record.setLastActivity(clock.instant());
                return result;
            }
        }
    }

    private <T> Optional<T> read(String userId, Function<MemoryRecord, T> reader) {
        MemoryRecord record = userId != null ? records.get(userId) : null;
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            return Optional.ofNullable(reader.apply(record));
        }
    }

    private MemoryRecord newRecord(String userId) {
        log.debug("[Memory] Creating memory record for {}", userId);
        return MemoryRecord.builder()
                .userId(userId)
                .lastActivity(clock.instant())
                .build();
    }

    private MemoryRecord normalize(String userId, MemoryRecord record) {
        record.setUserId(userId);
        if (record.getShortTerm() == null) {
            record.setShortTerm(new ShortTermMemory());
        }
        if (record.getShortTerm().getMessages() == null) {
            record.getShortTerm().setMessages(new ArrayList<>());
        }
        record.getShortTerm().trim(config().getShortTermCapacity());
        if (record.getLongTerm() == null) {
            record.setLongTerm(new LongTermMemory());
        }
        LongTermMemory longTerm = record.getLongTerm();
        if (longTerm.getFacts() == null) {
            longTerm.setFacts(new ArrayList<>());
        }
        if (longTerm.getPreferences() == null) {
            longTerm.setPreferences(new LinkedHashMap<>());
        }
        if (longTerm.getRecentQueries() == null) {
            longTerm.setRecentQueries(new ArrayList<>());
        }
        if (longTerm.getInsights() == null) {
            longTerm.setInsights(new LinkedHashMap<>());
        }
        if (record.getSession() == null) {
            record.setSession(new LinkedHashMap<>());
        }
        if (record.getLastActivity() == null) {
            record.setLastActivity(clock.instant());
        }
        return record;
    }

    private static String insightTopic(String key) {
        int dot = key.lastIndexOf('.');
        return (dot >= 0 ? key.substring(dot + 1) : key).replace('_', ' ').toLowerCase(Locale.ROOT);
    }

    private MemoryProperties config() {
        return properties.getMemory();
    }
}
