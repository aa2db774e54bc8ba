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
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ConsumerSurveyHandler extends AbstractAdvisorHandler {

    private static final Map<String, String> LABELS = labels(
            "city", "City",
            "demographic", "Demographic");

    private static final String PROMPT = """
            You are a consumer research analyst for the Indian restaurant industry.
            Summarize what is known about dining preferences and habits for the requested group:
            favoured cuisines, visit frequency, spending levels and ordering channels.
            Point out which findings matter most for someone opening a restaurant.
            """;

    public ConsumerSurveyHandler(LlmPort llmPort, AdvisorProperties properties, MessageService messageService) {
        super(llmPort, properties, messageService);
    }

    @Override
    public Intent intent() {
        return Intent.CONSUMER_SURVEY;
    }

    @Override
    protected Map<String, String> parameterLabels() {
        return LABELS;
    }

    @Override
    protected String systemPrompt(HandlerRequest request) {
        return PROMPT;
    }
}
