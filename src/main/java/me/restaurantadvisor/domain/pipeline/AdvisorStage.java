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

import me.restaurantadvisor.domain.model.RequestState;

/**
 * One step of the request pipeline. Stages run in ascending
 * {@link #getOrder()} and each returns the next immutable request state.
 */
public interface AdvisorStage {

    /**
     * Get the stage name.
     */
    String getName();

    /**
     * Get the processing order (lower = earlier).
     */
    int getOrder();

    /**
     * Process the state. Returns the next state.
     */
    RequestState process(RequestState state);

    /**
     * Check if this stage should process the given state.
     */
    default boolean shouldProcess(RequestState state) {
        return true;
    }

    /**
     * Check if stage is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
