package me.restaurantadvisor.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable state of one request. Every pipeline stage receives the current
 * state and returns a new one; nothing is shared between requests except the
 * user's memory record.
 */
@Value
@Builder(toBuilder = true)
public class RequestState {

    String requestId;
    AdvisorUser user;
    String query;

    @Builder.Default
    RequestPhase phase = RequestPhase.INIT;

    RoutingDecision routing;

    /**
     * Intent actually dispatched. Differs from the routed one after a denial.
     */
    Intent effectiveIntent;

    boolean accessDenied;

    ContextBundle context;

    String response;

    boolean handlerFailed;

    @Singular
    List<String> failures;

    public RequestState advance(RequestPhase next) {
        return toBuilder().phase(next).build();
    }

    public RequestState withFailure(String failure) {
        return toBuilder().failure(failure).build();
    }

    public boolean hasResponse() {
        return response != null && !response.isBlank();
    }
}
