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

import me.restaurantadvisor.domain.model.ContextBundle;
import me.restaurantadvisor.domain.model.RequestPhase;
import me.restaurantadvisor.domain.model.RequestState;
import me.restaurantadvisor.domain.service.ContextAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Gathers evidence for the effective intent.
 */
@Component
@RequiredArgsConstructor
public class ContextBuildingStage implements AdvisorStage {

    private final ContextAggregator contextAggregator;

    @Override
    public String getName() {
        return "ContextBuildingStage";
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public boolean shouldProcess(RequestState state) {
        return state.getEffectiveIntent() != null;
    }

    @Override
    public RequestState process(RequestState state) {
        ContextBundle bundle = contextAggregator.buildContext(state.getEffectiveIntent(),
                state.getRouting().getParameters(), state.getUser(), state.getQuery());
        return state.toBuilder()
                .context(bundle)
                .phase(RequestPhase.BUILD_CONTEXT)
                .build();
    }
}
