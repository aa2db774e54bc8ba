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

/**
 * Licensing, permit and compliance guidance.
 */
@Component
public class RegulatoryAdvisorHandler extends AbstractAdvisorHandler {

    private static final Map<String, String> LABELS = labels(
            "city", "City",
            "restaurant_type", "Restaurant type",
            "serves_alcohol", "Alcohol service",
            "seating_capacity", "Seating capacity");

    private static final String PROMPT = """
            You are a regulatory expert specializing in Indian restaurant licensing and permits.
            Based on the provided information, give detailed guidance on regulatory requirements:
            1. Required licenses and permits
            2. Application processes and typical timelines
            3. Estimated costs for all licenses
            4. Common compliance challenges
            5. Ongoing regulatory requirements

            Be comprehensive and practical, focusing on actionable steps.
            """;

    public RegulatoryAdvisorHandler(LlmPort llmPort, AdvisorProperties properties,
            MessageService messageService) {
        super(llmPort, properties, messageService);
    }

    @Override
    public Intent intent() {
        return Intent.REGULATORY_ADVISOR;
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
