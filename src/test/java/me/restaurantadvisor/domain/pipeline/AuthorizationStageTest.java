package me.restaurantadvisor.domain.pipeline;

import me.restaurantadvisor.domain.model.AdvisorUser;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.model.RoutingDecision;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import me.restaurantadvisor.testsupport.TestAdvisorProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationStageTest {

    private final AuthorizationStage stage = new AuthorizationStage(
            new AccessPolicyService(TestAdvisorProperties.withDefaultRoles()));

    @Test
    void process_allowedIntentIsDispatchedAsRouted() {
        RequestState next = stage.process(routed(TestAdvisorProperties.ANALYST, Intent.MARKET_ANALYSIS));

        assertEquals(Intent.MARKET_ANALYSIS, next.getEffectiveIntent());
        assertFalse(next.isAccessDenied());
        assertEquals(RequestPhase.AUTHORIZE, next.getPhase());
    }

    @Test
    void process_deniedIntentFallsBack() {
        RequestState next = stage.process(routed(TestAdvisorProperties.GUEST, Intent.MARKET_ANALYSIS));

        assertEquals(Intent.FALLBACK, next.getEffectiveIntent());
        assertTrue(next.isAccessDenied());
        assertEquals(RequestPhase.FALLBACK, next.getPhase());
        assertEquals(Intent.MARKET_ANALYSIS, next.getRouting().getIntent());
    }

    @Test
    void process_fallbackIntentAlwaysAllowed() {
        RequestState next = stage.process(routed("nobody", Intent.BASIC_QUERY));

        assertEquals(Intent.BASIC_QUERY, next.getEffectiveIntent());
        assertFalse(next.isAccessDenied());
    }

    @Test
    void shouldProcess_requiresRouting() {
        RequestState unrouted = RequestState.builder()
                .user(AdvisorUser.builder().id("u").role("admin").build())
                .query("q")
                .build();

        assertFalse(stage.shouldProcess(unrouted));
    }

    private static RequestState routed(String role, Intent intent) {
        return RequestState.builder()
                .user(AdvisorUser.builder().id("u-1").role(role).build())
                .query("q")
                .routing(RoutingDecision.builder().intent(intent).build())
                .phase(RequestPhase.ROUTE)
                .build();
    }
}
