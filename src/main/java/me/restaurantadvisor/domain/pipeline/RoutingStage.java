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

import me.restaurantadvisor.domain.model.AccessAction;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.model.RoutingDecision;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import me.restaurantadvisor.domain.service.MemoryStore;
import me.restaurantadvisor.routing.IntentRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Routes the query. Long-term preferences are offered to the router only when
 * the caller's role may read memory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoutingStage implements AdvisorStage {

    private final IntentRouter router;
    private final MemoryStore memoryStore;
    private final AccessPolicyService accessPolicy;

    @Override
    public String getName() {
        return "RoutingStage";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public RequestState process(RequestState state) {
        Map<String, String> preferences = Map.of();
        if (accessPolicy.canAccessMemory(state.getUser().getRole(), AccessAction.READ)) {
            preferences = memoryStore.preferences(state.getUser().getId());
        }
        RoutingDecision decision = router.route(state.getQuery(), preferences);
        log.debug("[Routing] {} -> {} ({})", state.getRequestId(), decision.getIntent(), decision.getRationale());
        return state.toBuilder()
                .routing(decision)
                .phase(RequestPhase.ROUTE)
                .build();
    }
}
