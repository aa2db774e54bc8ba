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

import me.restaurantadvisor.domain.model.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the handler for an intent. Intents without a registered handler
 * resolve to the fallback handler, which must be present.
 */
@Component
@Slf4j
public class IntentHandlerRegistry {

    private final Map<Intent, IntentHandler> handlers;

    public IntentHandlerRegistry(List<IntentHandler> handlers) {
        Map<Intent, IntentHandler> byIntent = new EnumMap<>(Intent.class);
        for (IntentHandler handler : handlers) {
            IntentHandler previous = byIntent.put(handler.intent(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for " + handler.intent() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        if (!byIntent.containsKey(Intent.FALLBACK)) {
            throw new IllegalStateException("No handler registered for fallback intent " + Intent.FALLBACK);
        }
        this.handlers = Collections.unmodifiableMap(byIntent);
        log.info("[Handlers] Registered {} intent handler(s): {}", byIntent.size(), byIntent.keySet());
    }

    public IntentHandler resolve(Intent intent) {
        IntentHandler handler = intent != null ? handlers.get(intent) : null;
        if (handler == null) {
            log.warn("[Handlers] No handler for {}, using {}", intent, Intent.FALLBACK);
            return handlers.get(Intent.FALLBACK);
        }
        return handler;
    }

    public boolean hasHandler(Intent intent) {
        return handlers.containsKey(intent);
    }
}
