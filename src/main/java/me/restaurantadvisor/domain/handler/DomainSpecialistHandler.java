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
import me.restaurantadvisor.domain.model.SpecialistDomain;
import me.restaurantadvisor.domain.service.AccessPolicyService;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.infrastructure.i18n.MessageService;
import me.restaurantadvisor.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catch-all specialist intent covering several business domains.
 *
 * <p>
 * The first {@link SpecialistDomain} matching the query answers, provided the
 * caller's role may use that domain; its response carries a
 * {@code [<DOMAIN> SPECIALIST RESPONSE]} prefix. Otherwise a general advisory
 * prompt is used without prefix.
 */
@Component
@Slf4j
public class DomainSpecialistHandler extends AbstractAdvisorHandler {

    private static final Map<String, String> LABELS = labels(
            "city", "City",
            "restaurant_type", "Restaurant type",
            "cuisine", "Cuisine",
            "scale", "Scale",
            "demographic", "Target demographic",
            "budget", "Budget");

    private static final String GENERAL_PROMPT = """
            You are a restaurant advisory specialist helping entrepreneurs in India.
            Give a helpful answer to this question about the restaurant business in India.
            Be practical, specific and data-driven in your advice.
            """;

    private static final Map<SpecialistDomain, String> DOMAIN_PROMPTS = new EnumMap<>(SpecialistDomain.class);

    static {
        DOMAIN_PROMPTS.put(SpecialistDomain.CUISINE, """
                You are a cuisine specialist advising restaurant entrepreneurs in India.
                Provide expert advice on cuisine strategy. Include:
                1. Current trends for this cuisine in the city
                2. Menu recommendations and adaptation suggestions for local tastes
                3. Pricing strategy recommendations
                4. Key ingredients and supply chain considerations
                5. Potential fusion opportunities with local flavors
                """);
        DOMAIN_PROMPTS.put(SpecialistDomain.FINANCIAL, """
                You are a financial advisor specializing in restaurant economics in India.
                Cover startup and operating costs, revenue projections, break-even timeline,
                funding options and the main financial risks.
                """);
        DOMAIN_PROMPTS.put(SpecialistDomain.STAFFING, """
                You are a staffing and HR specialist for restaurants in India.
                Cover staffing structure, recruitment channels, salary benchmarks, training
                and labor law compliance.
                """);
        DOMAIN_PROMPTS.put(SpecialistDomain.MARKETING, """
                You are a marketing and branding specialist for restaurants in India.
                Cover brand positioning, launch campaigns, social media and delivery platform
                presence, and customer retention.
                """);
        DOMAIN_PROMPTS.put(SpecialistDomain.TECHNOLOGY, """
                You are a technology and systems specialist for restaurants in India.
                Cover point of sale, inventory, online ordering and payment systems, with
                vendor options and implementation costs.
                """);
        DOMAIN_PROMPTS.put(SpecialistDomain.DESIGN, """
                You are a design and interior specialist for restaurants in India.
                Cover layout, seating, lighting, decor and ambiance suited to the concept,
                with budget ranges.
                """);
    }

    private final AccessPolicyService accessPolicy;

    public DomainSpecialistHandler(LlmPort llmPort, AdvisorProperties properties, MessageService messageService,
            AccessPolicyService accessPolicy) {
        super(llmPort, properties, messageService);
        this.accessPolicy = accessPolicy;
    }

    @Override
    public Intent intent() {
        return Intent.DOMAIN_SPECIALIST;
    }

    @Override
    protected Map<String, String> parameterLabels() {
        return LABELS;
    }

    @Override
    public String handle(HandlerRequest request) {
        Optional<SpecialistDomain> domain = selectDomain(request);
        if (domain.isEmpty()) {
            return generate(GENERAL_PROMPT, userPrompt(request), request.getContext());
        }
        log.debug("[Specialist] Answering as {} specialist", domain.get().getKey());
        String answer = generate(DOMAIN_PROMPTS.get(domain.get()), userPrompt(request), request.getContext());
        return messageService.getMessage("handler.specialist.prefix",
                (Object) domain.get().getKey().toUpperCase(Locale.ROOT)) + answer;
    }

    @Override
    protected String systemPrompt(HandlerRequest request) {
        return selectDomain(request).map(DOMAIN_PROMPTS::get).orElse(GENERAL_PROMPT);
    }

    /**
     * The matching domain, if the caller's role may use it.
     */
    Optional<SpecialistDomain> selectDomain(HandlerRequest request) {
        Optional<SpecialistDomain> domain = SpecialistDomain.select(request.getQuery(), request.getParameters());
        if (domain.isEmpty()) {
            return domain;
        }
        String role = request.getUser() != null ? request.getUser().getRole() : null;
        if (!accessPolicy.canAccessDomain(role, domain.get().getKey())) {
            log.info("[Specialist] Role '{}' may not use the {} domain, answering generally", role,
                    domain.get().getKey());
            return Optional.empty();
        }
        return domain;
    }
}
