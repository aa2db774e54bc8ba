package me.restaurantadvisor.domain.handler;

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

import me.restaurantadvisor.domain.model.HandlerRequest;
import me.restaurantadvisor.domain.model.Intent;

/**
 * Produces the answer for one routed intent.
 *
 * <p>
 * Implementations must tolerate missing or unexpected parameters and answer on
 * a best-effort basis. Any runtime exception that still escapes is turned
 * into a user-visible error message by the dispatch stage.
 *
 * @since 1.0
 * @see IntentHandlerRegistry
 */
public interface IntentHandler {

    /**
     * The intent this handler answers.
     */
    Intent intent();

    /**
     * Answer the request.
     *
     * @param request
     *            query, parameters, context bundle and optional user context
     * @return response text, never {@code null}
     */
    String handle(HandlerRequest request);
}
