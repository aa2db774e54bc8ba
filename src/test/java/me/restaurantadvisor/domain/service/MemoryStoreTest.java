package me.restaurantadvisor.domain.service;

import me.restaurantadvisor.domain.model.Message;
import me.restaurantadvisor.domain.model.UserContext;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MemoryStoreTest {

    private static final String USER_1 = "user-1";
    private static final String USER_2 = "user-2";
    private static final Instant START = Instant.parse("2026-01-10T10:00:00Z");

    private AdvisorProperties properties;
    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private Clock clock;
    private MemoryStore store;

    @BeforeEach
    void setUp() {
        properties = new AdvisorProperties();
        properties.getMemory().setShortTermCapacity(10);
        properties.getMemory().setSessionTimeoutSeconds(3600);

        storagePort = mock(StoragePort.class);
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(START);

        store = new MemoryStore(properties, new PreferenceExtractor(new CityGazetteer()), storagePort,
                objectMapper, clock);
    }

    @Test
    void touch_createsRecordLazily() {
        assertFalse(store.contains(USER_1));

        store.touch(USER_1);

        assertTrue(store.contains(USER_1));
        assertEquals(1, store.size());
    }

    @Test
    void append_keepsOnlyMostRecentMessagesInOrder() {
        for (int i = 0; i < 15; i++) {
            store.append(USER_1, userMessage("message " + i));
        }

        List<Message> messages = store.messages(USER_1);
        assertEquals(10, messages.size());
        for (int i = 0; i < 10; i++) {
            assertEquals("message " + (i + 5), messages.get(i).getContent());
        }
    }

    @Test
    void append_recordsUserQueriesInRecentHistory() {
        store.append(USER_1, userMessage("Where should I open a cafe?"));
        store.append(USER_1, Message.builder().role(Message.ROLE_ASSISTANT).content("In Pune").build());

        UserContext context = store.userContext(USER_1, "cafe");
        assertEquals(List.of("Where should I open a cafe?"), context.getRecentQueries());
    }

    @Test
    void extractAndMergePreferences_lastWriteWins() {
        store.extractAndMergePreferences(USER_1, "I like Italian food");
        store.extractAndMergePreferences(USER_1, "Actually I like Thai food");

        Map<String, String> preferences = store.preferences(USER_1);
        assertEquals("Thai", preferences.get(PreferenceExtractor.CUISINE));
        assertEquals(1, preferences.size());
    }

    @Test
    void extractAndMergePreferences_isIdempotent() {
        store.extractAndMergePreferences(USER_1, "premium thai restaurant in Mumbai");
        Map<String, String> first = store.preferences(USER_1);

        store.extractAndMergePreferences(USER_1, "premium thai restaurant in Mumbai");

        assertEquals(first, store.preferences(USER_1));
        assertEquals("High", first.get(PreferenceExtractor.BUDGET));
        assertEquals("Mumbai", first.get(PreferenceExtractor.CITY));
    }

    @Test
    void rememberFact_deduplicates() {
        assertTrue(store.rememberFact(USER_1, "Owns a bakery"));
        assertFalse(store.rememberFact(USER_1, "Owns a bakery"));

        assertEquals(List.of("Owns a bakery"), store.facts(USER_1));
    }

    @Test
    void evict_removesOnlyRecordsOlderThanTimeout() {
        store.touch(USER_1);
        when(clock.instant()).thenReturn(START.plusSeconds(3000));
        store.touch(USER_2);

        when(clock.instant()).thenReturn(START.plusSeconds(3601));
        int evicted = store.evict();

        assertEquals(1, evicted);
        assertFalse(store.contains(USER_1));
        assertTrue(store.contains(USER_2));
    }

    @Test
    void evict_keepsRecordAtExactTimeout() {
        store.touch(USER_1);

        when(clock.instant()).thenReturn(START.plusSeconds(3600));

        assertEquals(0, store.evict());
        assertTrue(store.contains(USER_1));
    }

    @Test
    void append_afterEvictionRecreatesRecord() {
        store.append(USER_1, userMessage("first"));
        when(clock.instant()).thenReturn(START.plusSeconds(7200));
        store.evict();

        store.append(USER_1, userMessage("second"));

        List<Message> messages = store.messages(USER_1);
        assertEquals(1, messages.size());
        assertEquals("second", messages.get(0).getContent());
    }

    @Test
    void clearSession_removesScratchButKeepsMemory() {
        store.append(USER_1, userMessage("hello"));
        store.putSessionValue(USER_1, "last_route", "basic_query");

        store.clearSession(USER_1);

        assertTrue(store.getSessionValue(USER_1, "last_route").isEmpty());
        assertEquals(1, store.messages(USER_1).size());
    }

    @Test
    void serializeThenDeserialize_restoresEveryUser() {
        store.append(USER_1, userMessage("Italian place in Delhi?"));
        store.append(USER_1, Message.builder().role(Message.ROLE_ASSISTANT).content("Try Connaught Place").build());
        store.extractAndMergePreferences(USER_1, "Italian place in Delhi?");
        store.rememberFact(USER_1, "Interested in location recommender for Delhi");
        store.append(USER_2, userMessage("licensing in Pune"));
        store.putSessionValue(USER_2, "last_route", "regulatory_advisor");

        Map<String, List<String>> contentsBefore = Map.of(
                USER_1, contents(store.messages(USER_1)),
                USER_2, contents(store.messages(USER_2)));
        Map<String, String> preferencesBefore = store.preferences(USER_1);
        List<String> factsBefore = store.facts(USER_1);

        String json = store.serialize();
        MemoryStore restored = new MemoryStore(properties, new PreferenceExtractor(new CityGazetteer()),
                storagePort, objectMapper, clock);
        assertEquals(2, restored.deserialize(json));

        assertEquals(contentsBefore.get(USER_1), contents(restored.messages(USER_1)));
        assertEquals(contentsBefore.get(USER_2), contents(restored.messages(USER_2)));
        assertEquals(Message.ROLE_ASSISTANT, restored.messages(USER_1).get(1).getRole());
        assertEquals(preferencesBefore, restored.preferences(USER_1));
        assertEquals(factsBefore, restored.facts(USER_1));
        assertEquals("regulatory_advisor", restored.getSessionValue(USER_2, "last_route").orElseThrow());
    }

    @Test
    void deserialize_acceptsMinimalRecord() {
        String json = """
                {"user-9": {"shortTerm": {"messages": [{"role": "user", "content": "hi"}]},
                            "lastActivity": 1768039200}}
                """;

        assertEquals(1, store.deserialize(json));
        assertEquals("hi", store.messages("user-9").get(0).getContent());
        assertTrue(store.preferences("user-9").isEmpty());
    }

    @Test
    void deserialize_rejectsMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> store.deserialize("not json"));
        assertThrows(IllegalArgumentException.class, () -> store.deserialize("[1, 2]"));
    }

    @Test
    void save_writesAtomicallyToMemoryFile() {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(null));
        store.append(USER_1, userMessage("hello"));

        store.save();

        verify(storagePort).putTextAtomic(eq("memory"), eq("user-memory.json"), contains(USER_1), eq(true));
    }

    @Test
    void load_skipsMissingFile() {
        when(storagePort.exists("memory", "user-memory.json")).thenReturn(CompletableFuture.completedFuture(false));

        store.load();

        assertEquals(0, store.size());
        verify(storagePort, never()).getText(anyString(), anyString());
    }

    @Test
    void load_survivesCorruptFile() {
        when(storagePort.exists("memory", "user-memory.json")).thenReturn(CompletableFuture.completedFuture(true));
        when(storagePort.getText("memory", "user-memory.json"))
                .thenReturn(CompletableFuture.completedFuture("{broken"));

        assertDoesNotThrow(() -> store.load());
        assertEquals(0, store.size());
    }

    @Test
    void userContext_selectsFactsByWordOverlap() {
        store.rememberFact(USER_1, "Interested in market analysis for Pune");
        store.rememberFact(USER_1, "Owns a bakery");
        store.extractAndMergePreferences(USER_1, "chinese");

        UserContext context = store.userContext(USER_1, "market in Pune");

        assertEquals(List.of("Interested in market analysis for Pune"), context.getFacts());
        assertEquals("Chinese", context.getPreferences().get(PreferenceExtractor.CUISINE));
    }

    @Test
    void concurrentAppends_neverExceedCapacity() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(200);
        try {
            for (int i = 0; i < 200; i++) {
                int n = i;
                executor.submit(() -> {
                    try {
                        store.append(USER_1, userMessage("m" + n));
                        if (n % 20 == 0) {
                            store.evict();
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(10, store.messages(USER_1).size());
    }

    private static Message userMessage(String content) {
        return Message.builder().role(Message.ROLE_USER).content(content).build();
    }

    private static List<String> contents(List<Message> messages) {
        List<String> result = new ArrayList<>();
        for (Message message : messages) {
            result.add(message.getContent());
        }
        return result;
    }
}
