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
 * Answers from research reports and studies in the knowledge base.
 */
@Component
public class PdfResearchHandler extends AbstractAdvisorHandler {

    private static final Map<String, String> LABELS = labels(
            "research_topic", "Research topic",
            "specific_focus", "Specific focus",
            "city", "City");

    private static final String PROMPT = """
            You are a specialized research agent for the restaurant industry in India.
            Your expertise lies in analyzing and synthesizing research papers, reports and regulatory
            documents about the restaurant business, food trends and market analysis.

            Give a well-structured answer that:
            1. Directly addresses the user's question
            2. Cites specific findings from the research
            3. Provides practical, actionable recommendations
            4. Acknowledges any limitations in the available research
            """;

    public PdfResearchHandler(LlmPort llmPort, AdvisorProperties properties, MessageService messageService) {
        super(llmPort, properties, messageService);
    }

    @Override
    public Intent intent() {
        return Intent.PDF_RESEARCH;
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
