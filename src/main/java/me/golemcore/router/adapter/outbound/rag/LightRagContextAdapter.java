package me.golemcore.router.adapter.outbound.rag;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.ContextPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Context retrieval from a LightRAG server ({@code POST /query}).
 *
 * <p>
 * Context is optional: any failure yields an empty string so the router goes
 * on without it.
 */
@Component
@Slf4j
public class LightRagContextAdapter implements ContextPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final RouterProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public LightRagContextAdapter(RouterProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getRag().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<String> retrieve(String query) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture("");
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                RouterProperties.RagProperties rag = properties.getRag();
                String body = objectMapper.writeValueAsString(new QueryRequest(query, rag.getQueryMode()));

                Request.Builder requestBuilder = new Request.Builder()
                        .url(rag.getUrl() + "/query")
                        .post(RequestBody.create(body, JSON));
                String apiKey = rag.getApiKey();
                if (apiKey != null && !apiKey.isBlank()) {
                    requestBuilder.header("Authorization", "Bearer " + apiKey);
                }

                try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                    ResponseBody responseBody = response.body();
                    if (!response.isSuccessful() || responseBody == null) {
                        log.warn("[RAG] Query failed: HTTP {}", response.code());
                        return "";
                    }
                    String context = parseQueryResponse(responseBody.string());
                    log.debug("[RAG] Retrieved {} chars of context", context.length());
                    return context;
                }
            } catch (IOException e) {
                log.warn("[RAG] Query error: {}", e.getMessage());
                return "";
            }
        });
    }

    @Override
    public boolean isAvailable() {
        return properties.getRag().isEnabled();
    }

    private String parseQueryResponse(String responseBody) {
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            if (node.has("response")) {
                return node.get("response").asText("");
            }
            return responseBody.trim();
        } catch (JsonProcessingException e) {
            log.debug("[RAG] Non-JSON query response, using raw text");
            return responseBody.trim();
        }
    }

    record QueryRequest(String query, String mode) {
    }
}
