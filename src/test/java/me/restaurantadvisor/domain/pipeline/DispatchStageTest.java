package me.restaurantadvisor.domain.pipeline;

import me.restaurantadvisor.domain.handler.IntentHandler;
import me.restaurantadvisor.domain.handler.IntentHandlerRegistry;
import me.restaurantadvisor.domain.model.AdvisorUser;
import me.restaurantadvisor.domain.model.ContextBundle;
import me.restaurantadvisor.domain.model.HandlerRequest;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.model.RoutingDecision;
import me.restaurantadvisor.domain.model.UserContext;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import me.restaurantadvisor.domain.service.MemoryStore;
import me.restaurantadvisor.infrastructure.i18n.MessageService;
import me.restaurantadvisor.testsupport.TestAdvisorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DispatchStageTest {

    private IntentHandler locationHandler;
    private IntentHandler fallbackHandler;
    private MemoryStore memoryStore;
    private DispatchStage stage;

    @BeforeEach
    void setUp() {
        locationHandler = handler(Intent.LOCATION_RECOMMENDER);
        fallbackHandler = handler(Intent.BASIC_QUERY);
        memoryStore = mock(MemoryStore.class);
        stage = new DispatchStage(new IntentHandlerRegistry(List.of(locationHandler, fallbackHandler)), memoryStore,
                new AccessPolicyService(TestAdvisorProperties.withDefaultRoles()), new MessageService());
    }

    @Test
    void process_invokesExactlyOneHandlerWithRequestData() {
        UserContext userContext = UserContext.builder().facts(List.of("fact")).build();
        when(memoryStore.userContext("u-1", "where?")).thenReturn(userContext);
        when(locationHandler.handle(any())).thenReturn("Go to Baner.");
        ContextBundle context = ContextBundle.builder().documents(List.of("doc")).build();

        RequestState next = stage.process(state(TestAdvisorProperties.ADMIN, Intent.LOCATION_RECOMMENDER, false)
                .toBuilder().context(context).build());

        assertEquals("Go to Baner.", next.getResponse());
        assertEquals(RequestPhase.DISPATCH, next.getPhase());
        ArgumentCaptor<HandlerRequest> captor = ArgumentCaptor.forClass(HandlerRequest.class);
        verify(locationHandler).handle(captor.capture());
        HandlerRequest request = captor.getValue();
        assertEquals(Map.of("city", "Pune"), request.getParameters());
        assertSame(context, request.getContext());
        assertSame(userContext, request.getUserContext());
        assertFalse(request.isAccessLimited());
        verify(fallbackHandler, never()).handle(any());
    }

    @Test
    void process_deniedRequestIsMarkedLimited() {
        when(fallbackHandler.handle(any())).thenReturn("limited");

        stage.process(state(TestAdvisorProperties.GUEST, Intent.BASIC_QUERY, true));

        ArgumentCaptor<HandlerRequest> captor = ArgumentCaptor.forClass(HandlerRequest.class);
        verify(fallbackHandler).handle(captor.capture());
        assertTrue(captor.getValue().isAccessLimited());
        assertNull(captor.getValue().getUserContext());
        verifyNoInteractions(memoryStore);
    }

    @Test
    void process_handlerFailureBecomesErrorResponse() {
        when(locationHandler.handle(any())).thenThrow(new IllegalStateException("prompt too long"));

        RequestState next = stage.process(state(TestAdvisorProperties.ADMIN, Intent.LOCATION_RECOMMENDER, false));

        assertTrue(next.isHandlerFailed());
        assertEquals("Sorry, I ran into a problem while preparing the location_recommender answer."
                + " Please try again in a moment.", next.getResponse());
        assertEquals(List.of("handler: prompt too long"), next.getFailures());
    }

    private static IntentHandler handler(Intent intent) {
        IntentHandler handler = mock(IntentHandler.class);
        when(handler.intent()).thenReturn(intent);
        return handler;
    }

    private static RequestState state(String role, Intent effective, boolean denied) {
        return RequestState.builder()
                .requestId("r-1")
                .user(AdvisorUser.builder().id("u-1").role(role).build())
                .query("where?")
                .routing(RoutingDecision.builder().intent(Intent.LOCATION_RECOMMENDER)
                        .parameters(Map.of("city", "Pune")).build())
                .effectiveIntent(effective)
                .accessDenied(denied)
                .build();
    }
}
