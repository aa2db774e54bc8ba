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

import me.restaurantadvisor.domain.model.ContextBundle;
import me.restaurantadvisor.domain.model.HandlerRequest;
import me.restaurantadvisor.domain.model.LlmRequest;
import me.restaurantadvisor.domain.model.LlmResponse;
import me.restaurantadvisor.domain.model.Message;
import me.restaurantadvisor.domain.model.UserContext;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.infrastructure.i18n.MessageService;
import me.restaurantadvisor.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Base class for handlers that answer through the LLM.
 *
 * <p>
 * The prompt is assembled from the handler's system prompt, the parameters the
 * handler cares about (absent ones are left out), the document snippets and
 * graph lines of the context bundle and, when present, the user's memory
 * digest.
 *
 * <p>
 * When no LLM provider is available, or the generation call fails or times
 * out, the handler answers with a plain digest of the context bundle instead.
 */
@Slf4j
public abstract class AbstractAdvisorHandler implements IntentHandler {

    protected final LlmPort llmPort;
    protected final AdvisorProperties properties;
    protected final MessageService messageService;

    protected AbstractAdvisorHandler(LlmPort llmPort, AdvisorProperties properties,
            MessageService messageService) {
        this.llmPort = llmPort;
        this.properties = properties;
        this.messageService = messageService;
    }

    /**
     * Role and instructions for the model.
     */
    protected abstract String systemPrompt(HandlerRequest request);

    /**
     * Parameter names this handler puts in the prompt, mapped to their labels,
     * in prompt order.
     */
    protected abstract Map<String, String> parameterLabels();

    @Override
    public String handle(HandlerRequest request) {
        return generate(systemPrompt(request), userPrompt(request), request.getContext());
    }

    protected String userPrompt(HandlerRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("User question: ").append(request.getQuery()).append("\n\n");

        StringBuilder params = new StringBuilder();
        parameterLabels().forEach((name, label) -> {
            String value = request.parameter(name);
            if (!value.isBlank()) {
                params.append("- ").append(label).append(": ").append(value).append('\n');
            }
        });
        if (params.length() > 0) {
            sb.append("User information:\n").append(params).append('\n');
        }

        ContextBundle context = request.getContext();
        sb.append("Context from knowledge base:\n").append(bullets(context.getDocuments())).append("\n\n");
        sb.append("Knowledge graph insights:\n").append(bullets(context.getGraphInsights()));

        UserContext userContext = request.getUserContext();
        if (userContext != null && !userContext.isEmpty()) {
            sb.append("\n\nAbout this user:\n").append(userContext.toPromptSection());
        }
        return sb.toString();
    }

    protected String generate(String systemPrompt, String userPrompt, ContextBundle context) {
        if (!llmPort.isAvailable()) {
            log.warn("[Handler] {} answering without LLM: provider unavailable", intent());
            return digest(context);
        }
        AdvisorProperties.LlmProperties llm = properties.getLlm();
        LlmRequest request = LlmRequest.builder()
                .model(llm.getModel())
                .systemPrompt(systemPrompt)
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content(userPrompt)
                        .build()))
                .temperature(llm.getTemperature())
                .build();

        long timeoutMs = properties.getHandlers().getTimeoutMs();
        try {
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response == null || response.getContent() == null || response.getContent().isBlank()) {
                log.warn("[Handler] {} got an empty LLM response", intent());
                return digest(context);
            }
            return response.getContent();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Handler] {} interrupted while waiting for LLM", intent());
            return digest(context);
        } catch (TimeoutException e) {
            log.warn("[Handler] {} LLM call timed out after {}ms, answering from context", intent(), timeoutMs);
            return digest(context);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Handler] {} LLM call FAILED, answering from context: {}", intent(), cause.getMessage());
            return digest(context);
        }
    }

    /**
     * Plain-text rendering of the context bundle used when no model is
     * available.
     */
    protected String digest(ContextBundle context) {
        if (context == null || context.isEmpty()) {
            return messageService.getMessage("handler.digest.empty");
        }
        StringBuilder sb = new StringBuilder(messageService.getMessage("handler.digest.header"));
        if (!context.getDocuments().isEmpty()) {
            sb.append("\n\n").append(messageService.getMessage("handler.digest.documents")).append('\n')
                    .append(bullets(context.getDocuments()));
        }
        if (!context.getGraphInsights().isEmpty()) {
            sb.append("\n\n").append(messageService.getMessage("handler.digest.graph")).append('\n')
                    .append(bullets(context.getGraphInsights()));
        }
        return sb.toString();
    }

    /**
     * Ordered label map from alternating parameter names and labels.
     */
    protected static Map<String, String> labels(String... namesAndLabels) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i + 1 < namesAndLabels.length; i += 2) {
            labels.put(namesAndLabels[i], namesAndLabels[i + 1]);
        }
        return Collections.unmodifiableMap(labels);
    }

    private static String bullets(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return "(none)";
        }
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("- ").append(line);
        }
        return sb.toString();
    }
}
