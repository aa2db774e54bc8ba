package me.restaurantadvisor.adapter.outbound.graph;

import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.TransactionContext;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class Neo4jGraphReaderAdapterTest {

    private Driver driver;
    private Session session;
    private TransactionContext tx;
    private Result result;
    private AdvisorProperties properties;
    private Neo4jGraphReaderAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        driver = mock(Driver.class);
        session = mock(Session.class);
        tx = mock(TransactionContext.class);
        result = mock(Result.class);
        properties = new AdvisorProperties();

        when(driver.session(any(SessionConfig.class))).thenReturn(session);
        when(tx.run(anyString(), anyMap())).thenReturn(result);
        when(session.executeRead(any())).thenAnswer(
                invocation -> invocation.<TransactionCallback<?>>getArgument(0).execute(tx));
        when(result.list(any(Function.class))).thenReturn(List.of());

        adapter = new Neo4jGraphReaderAdapter(driver, properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void recommendLocations_passesScoreThresholdAndNullCuisine() throws ExecutionException, InterruptedException {
        properties.getGraph().setMinLocationScore(0.6);
        properties.getGraph().setLocationLimit(4);

        adapter.recommendLocations("Pune", " ").get();

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(tx).run(eq(Neo4jGraphReaderAdapter.RECOMMEND_LOCATIONS), params.capture());
        assertEquals("Pune", params.getValue().get("city"));
        assertNull(params.getValue().get("cuisine"));
        assertEquals(0.6, params.getValue().get("minScore"));
        assertEquals(4, params.getValue().get("limit"));
        verify(session).close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void regulations_returnsRecordsAsMaps() throws ExecutionException, InterruptedException {
        List<Map<String, Object>> rows = List.of(Map.of("type", "FSSAI License"));
        when(result.list(any(Function.class))).thenReturn(rows);

        assertEquals(rows, adapter.regulations("Delhi").get());
        verify(tx).run(eq(Neo4jGraphReaderAdapter.REGULATIONS), eq(Map.of("city", "Delhi")));
    }

    @Test
    void sessionUsesConfiguredDatabase() throws ExecutionException, InterruptedException {
        properties.getGraph().setDatabase("advisor");

        adapter.cityDemographics("Jaipur").get();

        verify(driver).session(SessionConfig.forDatabase("advisor"));
    }

    @Test
    void driverFailureFailsTheFuture() {
        when(driver.session(any(SessionConfig.class))).thenThrow(new IllegalStateException("connection refused"));

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> adapter.regulations("Delhi").get());
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    @Test
    void countCuisines_ranksByNumberOfLocations() {
        List<Map<String, Object>> rows = List.of(
                Map.of("cuisines", List.of("North Indian", "Chinese")),
                Map.of("cuisines", List.of("Chinese", "Cafe")),
                Map.of("cuisines", List.of("Chinese", "North Indian")));

        List<Map<String, Object>> counted = Neo4jGraphReaderAdapter.countCuisines(rows);

        assertEquals(List.of(
                Map.of("cuisine_type", "Chinese", "popularity", 3),
                Map.of("cuisine_type", "North Indian", "popularity", 2),
                Map.of("cuisine_type", "Cafe", "popularity", 1)), counted);
    }

    @Test
    void countCuisines_ignoresRowsWithoutList() {
        assertTrue(Neo4jGraphReaderAdapter.countCuisines(List.of(Map.of("cuisines", "Thai"))).isEmpty());
    }
}
