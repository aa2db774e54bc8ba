package me.restaurantadvisor.domain.pipeline;

import me.restaurantadvisor.domain.model.AdvisorUser;
import me.restaurantadvisor.domain.model.ContextBundle;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.model.RoutingDecision;
import me.restaurantadvisor.domain.service.ContextAggregator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ContextBuildingStageTest {

    @Test
    void process_buildsContextForEffectiveIntentNotRoutedOne() {
        ContextAggregator aggregator = mock(ContextAggregator.class);
        ContextBundle bundle = ContextBundle.builder().documents(List.of("doc")).build();
        AdvisorUser user = AdvisorUser.builder().id("u-1").role("guest").build();
        when(aggregator.buildContext(Intent.BASIC_QUERY, Map.of("city", "Pune"), user, "rents in Pune"))
                .thenReturn(bundle);
        ContextBuildingStage stage = new ContextBuildingStage(aggregator);

        RequestState next = stage.process(RequestState.builder()
                .user(user)
                .query("rents in Pune")
                .routing(RoutingDecision.builder().intent(Intent.REAL_ESTATE).parameters(Map.of("city", "Pune"))
                        .build())
                .effectiveIntent(Intent.BASIC_QUERY)
                .accessDenied(true)
                .build());

        assertSame(bundle, next.getContext());
        assertEquals(RequestPhase.BUILD_CONTEXT, next.getPhase());
    }

    @Test
    void shouldProcess_requiresEffectiveIntent() {
        ContextBuildingStage stage = new ContextBuildingStage(mock(ContextAggregator.class));

        assertFalse(stage.shouldProcess(RequestState.builder().query("q").build()));
    }
}
