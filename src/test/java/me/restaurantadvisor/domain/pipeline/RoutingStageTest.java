package me.restaurantadvisor.domain.pipeline;

import me.restaurantadvisor.domain.model.AdvisorUser;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.model.RoutingDecision;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import me.restaurantadvisor.domain.service.MemoryStore;
import me.restaurantadvisor.routing.IntentRouter;
import me.restaurantadvisor.testsupport.TestAdvisorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RoutingStageTest {

    private static final RoutingDecision DECISION = RoutingDecision.builder()
            .intent(Intent.MARKET_ANALYSIS)
            .rationale("market")
            .build();

    private IntentRouter router;
    private MemoryStore memoryStore;
    private RoutingStage stage;

    @BeforeEach
    void setUp() {
        router = mock(IntentRouter.class);
        memoryStore = mock(MemoryStore.class);
        stage = new RoutingStage(router, memoryStore,
                new AccessPolicyService(TestAdvisorProperties.withDefaultRoles()));
        when(router.route(anyString(), anyMap())).thenReturn(DECISION);
    }

    @Test
    void process_passesPreferencesWhenRoleMayReadMemory() {
        when(memoryStore.preferences("u-1")).thenReturn(Map.of("city", "Pune"));

        RequestState next = stage.process(state(TestAdvisorProperties.ANALYST));

        verify(router).route("market trends", Map.of("city", "Pune"));
        assertSame(DECISION, next.getRouting());
        assertEquals(RequestPhase.ROUTE, next.getPhase());
    }

    @Test
    void process_withholdsPreferencesWithoutMemoryRead() {
        stage.process(state(TestAdvisorProperties.GUEST));

        verify(router).route("market trends", Map.of());
        verifyNoInteractions(memoryStore);
    }

    @Test
    void getOrder_runsFirst() {
        assertEquals(10, stage.getOrder());
    }

    private static RequestState state(String role) {
        return RequestState.builder()
                .requestId("r-1")
                .user(AdvisorUser.builder().id("u-1").role(role).build())
                .query("market trends")
                .build();
    }
}
