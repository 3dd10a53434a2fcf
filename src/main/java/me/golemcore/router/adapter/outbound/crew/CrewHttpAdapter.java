package me.golemcore.router.adapter.outbound.crew;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.DispatchOutcome;
import me.golemcore.router.domain.model.FailureKind;
import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.MultiAgentTask;
import me.golemcore.router.domain.service.ProviderFailureClassifier;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.MultiAgentPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Multi-agent collaborator reached over HTTP ({@code POST {url}/api/process}).
 *
 * <p>
 * The crew server runs its own agents on the model chosen by the router.
 * Status codes map to failure kinds the same way provider errors do: 429 is
 * quota, 401/403 is auth, anything else is transient. Connection failures are
 * reported as unsent.
 */
@Component
@Slf4j
public class CrewHttpAdapter implements MultiAgentPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String PROCESS_PATH = "/api/process";

    private final RouterProperties properties;
    private final OkHttpClient baseHttpClient;
    private final ObjectMapper objectMapper;

    public CrewHttpAdapter(RouterProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.baseHttpClient = baseHttpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<DispatchOutcome> execute(MultiAgentTask task) {
        ModelDescriptor model = task.getModel();
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(DispatchOutcome.failure(model.getId(), FailureKind.TRANSIENT,
                    "Multi-agent collaborator is disabled", false));
        }
        return CompletableFuture.supplyAsync(() -> post(task));
    }

    @Override
    public boolean isAvailable() {
        return properties.getCrew().isEnabled();
    }

    private DispatchOutcome post(MultiAgentTask task) {
        ModelDescriptor model = task.getModel();
        RouterProperties.CrewProperties crew = properties.getCrew();
        OkHttpClient client = task.getTimeout() != null
                ? baseHttpClient.newBuilder()
                        .callTimeout(task.getTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .readTimeout(task.getTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .build()
                : baseHttpClient;

        try {
            ProcessRequest payload = new ProcessRequest(task.getMessage(), model.getId(), model.getProvider(),
                    task.getScore() != null ? task.getScore().value() : null,
                    task.getScore() != null ? task.getScore().category().name().toLowerCase(Locale.ROOT) : null,
                    task.getContext());
            Request.Builder requestBuilder = new Request.Builder()
                    .url(crew.getUrl() + PROCESS_PATH)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON));
            if (crew.getApiKey() != null && !crew.getApiKey().isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + crew.getApiKey());
            }

            try (Response response = client.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                String body = responseBody != null ? responseBody.string() : "";
                if (!response.isSuccessful()) {
                    FailureKind kind = ProviderFailureClassifier.classifyHttpStatus(response.code());
                    log.warn("[Crew] {} failed: HTTP {} ({})", model.getId(), response.code(), kind);
                    return DispatchOutcome.failure(model.getId(), kind, "HTTP " + response.code(), true);
                }
                return parseResponse(model, body);
            }
        } catch (IOException e) {
            boolean sent = ProviderFailureClassifier.wasSent(e);
            log.warn("[Crew] Request for {} failed (sent={}): {}", model.getId(), sent, e.getMessage());
            return DispatchOutcome.failure(model.getId(), FailureKind.TRANSIENT, e.getMessage(), sent);
        }
    }

    private DispatchOutcome parseResponse(ModelDescriptor model, String body) throws IOException {
        JsonNode node = objectMapper.readTree(body);
        if (node.hasNonNull("error")) {
            String error = node.get("error").asText();
            FailureKind kind = ProviderFailureClassifier.classify(new IOException(error));
            log.warn("[Crew] {} reported error ({}): {}", model.getId(), kind, error);
            return DispatchOutcome.failure(model.getId(), kind, error, true);
        }
        String content = node.hasNonNull("response") ? node.get("response").asText() : "";
        if (content.isBlank()) {
            return DispatchOutcome.failure(model.getId(), FailureKind.TRANSIENT, "Empty crew response", true);
        }
        log.debug("[Crew] {} responded with {} chars", model.getId(), content.length());
        return DispatchOutcome.success(model.getId(), content);
    }

    record ProcessRequest(String message,
            @JsonProperty("model_id") String modelId,
            String provider,
            Integer complexity,
            String category,
            String context) {
    }
}
