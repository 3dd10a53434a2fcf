package me.golemcore.router.adapter.outbound.llm;

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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.DispatchOutcome;
import me.golemcore.router.domain.model.DispatchRequest;
import me.golemcore.router.domain.model.FailureKind;
import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.service.ProviderFailureClassifier;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.CredentialPort;
import me.golemcore.router.port.outbound.ModelTransportPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Direct single-call transport over langchain4j chat models.
 *
 * <p>
 * Chat models are built lazily and reused per model, API key and call timeout.
 * The call timeout is the request's remaining deadline, capped at
 * {@code router.routing.request-timeout} and rounded up to whole seconds, so
 * a provider call never outlives the request by more than a second. Provider
 * exceptions never escape: they are classified into a failed
 * {@link DispatchOutcome}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jTransportAdapter implements ModelTransportPort {

    private final ChatModelFactory chatModelFactory;
    private final CredentialPort credentialPort;
    private final RouterProperties properties;
    private final Clock clock;

    private final Map<ChatModelKey, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<DispatchOutcome> dispatch(DispatchRequest request) {
        return CompletableFuture.supplyAsync(() -> call(request));
    }

    private DispatchOutcome call(DispatchRequest request) {
        ModelDescriptor model = request.getModel();
        Optional<String> apiKey = credentialPort.getApiKeyForProvider(model.getProvider());
        if (apiKey.isEmpty()) {
            log.warn("[LLM] No API key for provider {}, {} not called", model.getProvider(), model.getId());
            return DispatchOutcome.failure(model.getId(), FailureKind.AUTH_ERROR,
                    "No API key configured for provider " + model.getProvider(), false);
        }

        Duration timeout = callTimeout(request.getTimeout(), properties.getRouting().getRequestTimeout());
        log.debug("[LLM] Calling {} (~{} tokens, timeout {}s)", model.getId(), request.getEstimatedTokens(),
                timeout.toSeconds());
        Instant started = clock.instant();
        try {
            ChatModel chatModel = models.computeIfAbsent(new ChatModelKey(model.getId(), apiKey.get(), timeout),
                    key -> chatModelFactory.create(model, key.apiKey(), key.timeout()));
            ChatResponse response = chatModel.chat(ChatRequest.builder()
                    .messages(buildMessages(request))
                    .build());
            return toOutcome(model, response, Duration.between(started, clock.instant()));
        } catch (RuntimeException e) {
            FailureKind kind = ProviderFailureClassifier.classify(e);
            boolean sent = ProviderFailureClassifier.wasSent(e);
            log.warn("[LLM] Call to {} failed ({}, sent={}): {}", model.getId(), kind, sent, e.getMessage());
            return DispatchOutcome.builder()
                    .modelId(model.getId())
                    .failureKind(kind)
                    .message(e.getMessage())
                    .sent(sent)
                    .latency(Duration.between(started, clock.instant()))
                    .build();
        }
    }

    static Duration callTimeout(Duration requested, Duration ceiling) {
        Duration timeout = requested == null || requested.compareTo(ceiling) > 0 ? ceiling : requested;
        long seconds = timeout.toSeconds();
        if (timeout.toNanosPart() > 0 || seconds == 0) {
            seconds++;
        }
        return Duration.ofSeconds(seconds);
    }

    private List<ChatMessage> buildMessages(DispatchRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getUserMessage()));
        return messages;
    }

    private DispatchOutcome toOutcome(ModelDescriptor model, ChatResponse response, Duration latency) {
        String content = response.aiMessage() != null ? response.aiMessage().text() : null;
        if (content == null || content.isBlank()) {
            return DispatchOutcome.builder()
                    .modelId(model.getId())
                    .failureKind(FailureKind.TRANSIENT)
                    .message("Empty response")
                    .sent(true)
                    .latency(latency)
                    .build();
        }
        TokenUsage usage = response.tokenUsage();
        log.debug("[LLM] {} responded in {}ms", model.getId(), latency.toMillis());
        return DispatchOutcome.builder()
                .modelId(model.getId())
                .content(content)
                .sent(true)
                .inputTokens(usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0)
                .outputTokens(usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0)
                .latency(latency)
                .build();
    }

    private record ChatModelKey(String modelId, String apiKey, Duration timeout) {
    }
}
