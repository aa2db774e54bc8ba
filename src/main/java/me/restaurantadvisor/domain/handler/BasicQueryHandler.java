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
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.infrastructure.i18n.MessageService;
import me.restaurantadvisor.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Universal fallback handler.
 *
 * <p>
 * Answers general questions and every request that was redirected here after
 * an access denial. In the latter case the answer is wrapped in an access
 * limitation notice.
 */
@Component
@Slf4j
public class BasicQueryHandler extends AbstractAdvisorHandler {

    private static final Map<String, String> LABELS = labels("city", "City");

    private static final String PROMPT = """
            You are an assistant for restaurant entrepreneurs looking to expand in India.
            Answer the user's question based on the provided information, keeping in mind
            you have limited access to detailed data. If you cannot answer fully, explain
            what additional access would be needed.
            """;

    public BasicQueryHandler(LlmPort llmPort, AdvisorProperties properties, MessageService messageService) {
        super(llmPort, properties, messageService);
    }

    @Override
    public Intent intent() {
        return Intent.BASIC_QUERY;
    }

    @Override
    protected Map<String, String> parameterLabels() {
        return LABELS;
    }

    @Override
    protected String systemPrompt(HandlerRequest request) {
        return PROMPT;
    }

    @Override
    public String handle(HandlerRequest request) {
        if (!request.isAccessLimited()) {
            return super.handle(request);
        }
        String answer;
        try {
            answer = super.handle(request);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Handler] Limited-access answer FAILED, using context digest: {}", e.getMessage());
            answer = digest(request.getContext());
        }
        return messageService.getMessage("handler.access.limited", (Object) answer);
    }
}
