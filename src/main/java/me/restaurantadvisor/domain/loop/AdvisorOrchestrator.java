package me.restaurantadvisor.domain.loop;

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

import me.restaurantadvisor.domain.model.AccessAction;
import me.restaurantadvisor.domain.model.AdvisorUser;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.Message;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.model.RoutingDecision;
import me.restaurantadvisor.domain.pipeline.AdvisorStage;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import me.restaurantadvisor.domain.service.MemoryStore;
import me.restaurantadvisor.infrastructure.i18n.MessageService;
import me.restaurantadvisor.port.inbound.AdvisorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Drives one request through the stage pipeline
 * (Routing -> Authorization -> ContextBuilding -> Dispatch) and records the
 * exchange in the user's memory.
 *
 * <p>
 * The orchestrator keeps no state between requests; everything that survives
 * a request lives in the {@link MemoryStore}. A failing stage is logged and
 * recorded in the request state and the remaining stages still run, so every
 * request ends with a response string.
 */
@Component
@Slf4j
public class AdvisorOrchestrator implements AdvisorPort {

    public static final String SESSION_LAST_ROUTE = "last_route";
    public static final String SESSION_LAST_PARAMETERS = "last_parameters";
    public static final String SESSION_LAST_RESPONSE = "last_response";

    private final List<AdvisorStage> stages;
    private final MemoryStore memoryStore;
    private final AccessPolicyService accessPolicy;
    private final MessageService messageService;
    private final Clock clock;

    public AdvisorOrchestrator(List<AdvisorStage> stages, MemoryStore memoryStore, AccessPolicyService accessPolicy,
            MessageService messageService, Clock clock) {
        List<AdvisorStage> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(AdvisorStage::getOrder));
        this.stages = List.copyOf(sorted);
        this.memoryStore = memoryStore;
        this.accessPolicy = accessPolicy;
        this.messageService = messageService;
        this.clock = clock;
    }

    @Override
    public String ask(AdvisorUser user, String query) {
        if (user == null || user.getId() == null) {
            log.warn("Rejecting query without an identified user");
            return messageService.getMessage("advisor.error.request");
        }
        if (query == null || query.isBlank()) {
            return messageService.getMessage("advisor.query.empty");
        }

        String requestId = UUID.randomUUID().toString().substring(0, 8);
        log.info("=== INCOMING QUERY === request={}, user={}, role={}", requestId, user.getId(), user.getRole());

        memoryStore.append(user.getId(), Message.builder()
                .role(Message.ROLE_USER)
                .content(query)
                .timestamp(clock.instant())
                .build());
        memoryStore.extractAndMergePreferences(user.getId(), query);
        boolean mayWriteMemory = accessPolicy.canAccessMemory(user.getRole(), AccessAction.WRITE);

        RequestState state = RequestState.builder()
                .requestId(requestId)
                .user(user)
                .query(query)
                .build();
        state = runStages(state);

        String response = state.hasResponse() ? state.getResponse()
                : messageService.getMessage("advisor.error.request");
        state = state.toBuilder().response(response).phase(RequestPhase.DONE).build();

        record(state, mayWriteMemory);
        log.info("=== DONE === request={}, intent={}, denied={}, failures={}", requestId,
                state.getEffectiveIntent(), state.isAccessDenied(), state.getFailures().size());
        return response;
    }

    @Override
    public void logout(String userId) {
        memoryStore.clearSession(userId);
    }

    RequestState runStages(RequestState initial) {
        RequestState state = initial;
        for (AdvisorStage stage : stages) {
            if (!stage.isEnabled()) {
                log.debug("Stage '{}' is disabled, skipping", stage.getName());
                continue;
            }
            if (!stage.shouldProcess(state)) {
                log.debug("Stage '{}' shouldProcess=false, skipping", stage.getName());
                continue;
            }
            long startMs = clock.millis();
            try {
                state = stage.process(state);
                log.debug("Stage '{}' completed in {}ms", stage.getName(), clock.millis() - startMs);
            } catch (RuntimeException e) { // NOSONAR - a stage failure must not abort the request
                log.error("Stage '{}' FAILED after {}ms: {}", stage.getName(), clock.millis() - startMs,
                        e.getMessage(), e);
                state = recover(state, stage, e);
            }
        }
        return state;
    }

    /**
     * Keeps the pipeline moving after a failed stage. A request that could not
     * be routed or authorized continues on the fallback intent.
     */
    private RequestState recover(RequestState state, AdvisorStage stage, RuntimeException e) {
        RequestState next = state.withFailure(stage.getName() + ": " + e.getMessage());
        if (next.getRouting() == null) {
            next = next.toBuilder()
                    .routing(RoutingDecision.fallback("Routing failed, using general assistance"))
                    .build();
        }
        if (next.getEffectiveIntent() == null && next.getPhase() != RequestPhase.INIT) {
            next = next.toBuilder().effectiveIntent(Intent.FALLBACK).build();
        }
        return next;
    }

    private void record(RequestState state, boolean mayWriteMemory) {
        String userId = state.getUser().getId();
        memoryStore.append(userId, Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(state.getResponse())
                .timestamp(clock.instant())
                .build());

        Intent intent = state.getEffectiveIntent() != null ? state.getEffectiveIntent() : Intent.FALLBACK;
        memoryStore.putSessionValue(userId, SESSION_LAST_ROUTE, intent.getWireName());
        memoryStore.putSessionValue(userId, SESSION_LAST_PARAMETERS, state.getRouting() != null
                ? new LinkedHashMap<>(state.getRouting().getParameters())
                : new LinkedHashMap<>());
        memoryStore.putSessionValue(userId, SESSION_LAST_RESPONSE, state.getResponse());

        if (mayWriteMemory && !state.isAccessDenied() && !intent.isFallback() && state.getRouting() != null) {
            state.getRouting().parameter("city").ifPresent(city -> memoryStore.rememberFact(userId,
                    "Interested in " + intent.getWireName().replace('_', ' ').toLowerCase(Locale.ROOT)
                            + " for " + city));
        }
    }
}
