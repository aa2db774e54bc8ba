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
 * Recommends areas within a city for a new restaurant.
 */
@Component
public class LocationRecommenderHandler extends AbstractAdvisorHandler {

    private static final Map<String, String> LABELS = labels(
            "concept", "Restaurant concept",
            "cuisine", "Target cuisine",
            "demographic", "Target demographic",
            "budget", "Budget constraints",
            "city", "City");

    public LocationRecommenderHandler(LlmPort llmPort, AdvisorProperties properties,
            MessageService messageService) {
        super(llmPort, properties, messageService);
    }

    @Override
    public Intent intent() {
        return Intent.LOCATION_RECOMMENDER;
    }

    @Override
    protected Map<String, String> parameterLabels() {
        return LABELS;
    }

    @Override
    protected String systemPrompt(HandlerRequest request) {
        String city = request.parameter("city");
        String where = city.isBlank() ? "the city" : city;
        return """
                You are a restaurant location recommender specialist with deep knowledge about Indian cities
                and their commercial real estate. Recommend the best areas within a city for a new restaurant
                based on the provided information.

                Recommend the top 3 locations within %s. For each location, provide:
                1. Area name
                2. Why it is suitable (foot traffic, demographics match, etc.)
                3. Potential challenges
                4. Approximate setup costs
                5. Regulatory considerations

                Provide a structured response with clear recommendations and reasoning.
                """.formatted(where);
    }
}
