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
 * Market potential, competition and pricing analysis for a concept.
 */
@Component
public class MarketAnalysisHandler extends AbstractAdvisorHandler {

    private static final Map<String, String> LABELS = labels(
            "concept", "Restaurant concept",
            "cuisine", "Cuisine type",
            "city", "Target city",
            "area", "Target area",
            "demographic", "Target demographic");

    private static final String PROMPT = """
            You are a restaurant market analyst with expertise in Indian food markets and consumer preferences.
            Analyze the market potential for the given restaurant concept. Cover:
            - Market potential, with a 0-10 score and the reasoning behind it
            - Competition: saturation level, major competitors, differentiation opportunities
            - Relevant consumer trends and recommendations
            - Pricing strategy: budget, mid-range or premium, and why
            - Risk factors, each with a mitigation strategy

            Keep the analysis data-driven and specific to the Indian market.
            """;

    public MarketAnalysisHandler(LlmPort llmPort, AdvisorProperties properties, MessageService messageService) {
        super(llmPort, properties, messageService);
    }

    @Override
    public Intent intent() {
        return Intent.MARKET_ANALYSIS;
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
