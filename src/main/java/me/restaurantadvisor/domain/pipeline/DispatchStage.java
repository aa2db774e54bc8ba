package me.restaurantadvisor.domain.pipeline;

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

import me.restaurantadvisor.domain.handler.IntentHandler;
import me.restaurantadvisor.domain.handler.IntentHandlerRegistry;
import me.restaurantadvisor.domain.model.AccessAction;
import me.restaurantadvisor.domain.model.ContextBundle;
import me.restaurantadvisor.domain.model.HandlerRequest;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.model.UserContext;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import me.restaurantadvisor.domain.service.MemoryStore;
import me.restaurantadvisor.infrastructure.i18n.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs exactly one handler for the effective intent.
 *
 * <p>
 * A handler failure is converted into a user-visible error response; the
 * request still completes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DispatchStage implements AdvisorStage {

    private final IntentHandlerRegistry handlers;
    private final MemoryStore memoryStore;
    private final AccessPolicyService accessPolicy;
    private final MessageService messageService;

    @Override
    public String getName() {
        return "DispatchStage";
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public boolean shouldProcess(RequestState state) {
        return state.getEffectiveIntent() != null;
    }

    @Override
    public RequestState process(RequestState state) {
        Intent intent = state.getEffectiveIntent();
        IntentHandler handler = handlers.resolve(intent);
        HandlerRequest request = HandlerRequest.builder()
                .query(state.getQuery())
                .intent(handler.intent())
                .user(state.getUser())
                .parameters(state.getRouting() != null ? state.getRouting().getParameters() : Map.of())
                .context(state.getContext() != null ? state.getContext() : ContextBundle.empty())
                .userContext(userContext(state))
                .accessLimited(state.isAccessDenied())
                .build();

        try {
            String response = handler.handle(request);
            log.info("[Dispatch] {} answered {} ({} chars)", handler.getClass().getSimpleName(),
                    state.getRequestId(), response != null ? response.length() : 0);
            return state.toBuilder()
                    .response(response)
                    .phase(RequestPhase.DISPATCH)
                    .build();
        } catch (RuntimeException e) { // NOSONAR - handler failure must not abort the request
            log.error("[Dispatch] Handler for {} FAILED: {}", intent, e.getMessage(), e);
            return state.toBuilder()
                    .response(messageService.getMessage("advisor.error.handler", (Object) intent.getWireName()))
                    .handlerFailed(true)
                    .failure("handler: " + e.getMessage())
                    .phase(RequestPhase.DISPATCH)
                    .build();
        }
    }

    private UserContext userContext(RequestState state) {
        if (!accessPolicy.canAccessMemory(state.getUser().getRole(), AccessAction.READ)) {
            return null;
        }
        return memoryStore.userContext(state.getUser().getId(), state.getQuery());
    }
}
