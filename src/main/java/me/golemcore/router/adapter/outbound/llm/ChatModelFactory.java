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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds langchain4j chat models for registry entries.
 *
 * <p>
 * Providers speaking the Anthropic protocol get an {@link AnthropicChatModel};
 * everything else goes through the OpenAI-compatible client with the
 * provider's base URL. SDK retries are disabled, the router owns retries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatModelFactory {

    static final String PROTOCOL_ANTHROPIC = "anthropic";

    private final RouterProperties properties;

    /**
     * Build a chat model whose HTTP calls give up after {@code timeout}.
     */
    public ChatModel create(ModelDescriptor model, String apiKey, Duration timeout) {
        RouterProperties.ProviderProperties config = properties.getProviders().get(model.getProvider());
        if (config == null) {
            config = new RouterProperties.ProviderProperties();
        }
        log.debug("[LLM] Creating chat model {} via {} protocol, timeout {}s", model.getId(), config.getProtocol(),
                timeout.toSeconds());

        if (PROTOCOL_ANTHROPIC.equalsIgnoreCase(config.getProtocol())) {
            return createAnthropicModel(model, config, apiKey, timeout);
        }
        return createOpenAiModel(model, config, apiKey, timeout);
    }

    private ChatModel createAnthropicModel(ModelDescriptor model, RouterProperties.ProviderProperties config,
            String apiKey, Duration timeout) {
        var builder = AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(model.getProviderModelName())
                .maxRetries(0)
                .maxTokens(properties.getLlm().getMaxOutputTokens())
                .temperature(properties.getLlm().getTemperature())
                .timeout(timeout);

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(ModelDescriptor model, RouterProperties.ProviderProperties config,
            String apiKey, Duration timeout) {
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(model.getProviderModelName())
                .maxRetries(0)
                .maxTokens(properties.getLlm().getMaxOutputTokens())
                .temperature(properties.getLlm().getTemperature())
                .timeout(timeout);

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
