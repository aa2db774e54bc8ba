package me.restaurantadvisor.adapter.outbound.llm;

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

import me.restaurantadvisor.domain.model.LlmRequest;
import me.restaurantadvisor.domain.model.LlmResponse;
import me.restaurantadvisor.domain.model.Message;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.port.outbound.LlmPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j OpenAI chat model.
 *
 * <p>
 * Works against OpenAI or any OpenAI-compatible endpoint configured through
 * {@code advisor.llm.base-url}. Model name, temperature and token limit are
 * set per request. Rate-limit errors are retried with exponential backoff;
 * any other error fails the returned future.
 *
 * <p>
 * Provider ID: {@code "openai"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final AdvisorProperties properties;

    private volatile ChatModel chatModel;

    private synchronized ChatModel ensureInitialized() {
        if (chatModel == null) {
            AdvisorProperties.LlmProperties config = properties.getLlm();
            var builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .temperature(config.getTemperature())
                    .maxRetries(0) // Retry handled by our backoff logic
                    .timeout(Duration.ofMillis(config.getTimeoutMs()));
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            chatModel = builder.build();
            log.info("Langchain4j adapter initialized with model: {}", config.getModel());
        }
        return chatModel;
    }

    @Override
    public String getProviderId() {
        return "openai";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new IllegalStateException("LLM provider not configured");
            }
            ChatModel model = ensureInitialized();
            ChatRequest chatRequest = toChatRequest(request);

            AdvisorProperties.LlmProperties config = properties.getLlm();
            int maxRetries = config.getMaxRetries();
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    ChatResponse response = model.chat(chatRequest);
                    return toLlmResponse(response, chatRequest.modelName());
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (config.getInitialBackoffMs() * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, maxRetries, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed: {}", e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    ChatRequest toChatRequest(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        if (request.getMessages() != null) {
            for (Message msg : request.getMessages()) {
                switch (msg.getRole()) {
                case Message.ROLE_ASSISTANT -> messages.add(AiMessage.from(msg.getContent()));
                case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
                case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
                default -> {
                    log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                    messages.add(UserMessage.from(msg.getContent()));
                }
                }
            }
        }

        String model = request.getModel() != null ? request.getModel() : properties.getLlm().getModel();
        return ChatRequest.builder()
                .messages(messages)
                .modelName(model)
                .temperature(request.getTemperature() != null ? request.getTemperature()
                        : properties.getLlm().getTemperature())
                .maxOutputTokens(request.getMaxTokens())
                .build();
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private static LlmResponse toLlmResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }
}
