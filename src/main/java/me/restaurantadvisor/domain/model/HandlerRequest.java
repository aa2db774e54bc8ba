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
import lombok.Value;

import java.util.Map;

/**
 * Everything an intent handler receives for one request.
 */
@Value
@Builder
public class HandlerRequest {

    String query;
    Intent intent;
    AdvisorUser user;

    @Builder.Default
    Map<String, String> parameters = Map.of();

    @Builder.Default
    ContextBundle context = ContextBundle.empty();

    /**
     * Null when the caller's role may not read memory.
     */
    UserContext userContext;

    /**
     * Set when the routed intent was denied and this request was redirected to
     * the fallback handler.
     */
    boolean accessLimited;

    public String parameter(String name) {
        String value = parameters.get(name);
        return value != null ? value : "";
    }
}
