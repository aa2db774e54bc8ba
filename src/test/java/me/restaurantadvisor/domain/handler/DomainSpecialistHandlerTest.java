package me.restaurantadvisor.domain.handler;

import me.restaurantadvisor.domain.model.AdvisorUser;
import me.restaurantadvisor.domain.model.HandlerRequest;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.LlmRequest;
import me.restaurantadvisor.domain.model.LlmResponse;
import me.restaurantadvisor.domain.model.SpecialistDomain;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.infrastructure.i18n.MessageService;
import me.restaurantadvisor.port.outbound.LlmPort;
import me.restaurantadvisor.testsupport.TestAdvisorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DomainSpecialistHandlerTest {

    private LlmPort llmPort;
    private DomainSpecialistHandler handler;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Advice.").build()));
        AdvisorProperties properties = TestAdvisorProperties.withDefaultRoles();
        handler = new DomainSpecialistHandler(llmPort, properties, new MessageService(),
                new AccessPolicyService(properties));
    }

    @Test
    void handle_prefixesAnswerWithPermittedDomain() {
        String answer = handler.handle(request("How many staff do I need?", TestAdvisorProperties.OPERATIONS,
                Map.of()));

        assertEquals("[STAFFING SPECIALIST RESPONSE]\n\nAdvice.", answer);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertTrue(captor.getValue().getSystemPrompt().contains("staffing and HR specialist"));
    }

    @Test
    void handle_answersGenerallyWhenDomainNotPermitted() {
        String answer = handler.handle(request("What marketing campaign should I run?",
                TestAdvisorProperties.OPERATIONS, Map.of()));

        assertEquals("Advice.", answer);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertTrue(captor.getValue().getSystemPrompt().contains("restaurant advisory specialist"));
    }

    @Test
    void handle_answersGenerallyWhenNoDomainMatches() {
        String answer = handler.handle(request("Any general tips?", TestAdvisorProperties.ADMIN, Map.of()));

        assertEquals("Advice.", answer);
    }

    @Test
    void selectDomain_cuisineParameterSelectsCuisine() {
        Optional<SpecialistDomain> domain = handler.selectDomain(request("What should I do?",
                TestAdvisorProperties.OWNER, Map.of("cuisine", "Bengali")));

        assertEquals(Optional.of(SpecialistDomain.CUISINE), domain);
    }

    @Test
    void selectDomain_firstDomainInPriorityOrderWins() {
        // "menu" (cuisine) outranks "pricing" (financial)
        Optional<SpecialistDomain> domain = handler.selectDomain(request("menu pricing ideas",
                TestAdvisorProperties.ADMIN, Map.of()));

        assertEquals(Optional.of(SpecialistDomain.CUISINE), domain);
    }

    @Test
    void selectDomain_emptyForUnknownRole() {
        assertTrue(handler.selectDomain(request("menu ideas", "visitor", Map.of())).isEmpty());
    }

    private static HandlerRequest request(String query, String role, Map<String, String> params) {
        return HandlerRequest.builder()
                .query(query)
                .intent(Intent.DOMAIN_SPECIALIST)
                .user(AdvisorUser.builder().id("u-1").role(role).build())
                .parameters(params)
                .build();
    }
}
