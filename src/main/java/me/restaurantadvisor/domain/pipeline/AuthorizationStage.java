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

import me.restaurantadvisor.domain.model.AccessDecision;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks the routed intent against the caller's role. A denied request
 * continues on the fallback path with the denial recorded in the state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthorizationStage implements AdvisorStage {

    private final AccessPolicyService accessPolicy;

    @Override
    public String getName() {
        return "AuthorizationStage";
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public boolean shouldProcess(RequestState state) {
        return state.getRouting() != null;
    }

    @Override
    public RequestState process(RequestState state) {
        String role = state.getUser().getRole();
        AccessDecision decision = accessPolicy.authorize(role, state.getRouting().getIntent());
        if (decision.allowed()) {
            return state.toBuilder()
                    .effectiveIntent(decision.effectiveIntent())
                    .phase(RequestPhase.AUTHORIZE)
                    .build();
        }
        log.info("[Authorization] Role '{}' denied {}, falling back to {}", role,
                state.getRouting().getIntent(), decision.effectiveIntent());
        return state.toBuilder()
                .effectiveIntent(decision.effectiveIntent())
                .accessDenied(true)
                .phase(RequestPhase.FALLBACK)
                .build();
    }
}
