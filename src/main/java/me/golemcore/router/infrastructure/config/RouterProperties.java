package me.golemcore.router.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the router, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code router.*} prefix:
 * <ul>
 * <li>{@link RegistryProperties} - where the model catalogue lives</li>
 * <li>{@link UsageProperties} - quota window lengths</li>
 * <li>{@link BlacklistProperties} - ban durations and sweep interval</li>
 * <li>{@link RoutingProperties} - retry bounds, deadlines, task types</li>
 * <li>{@link ClassifierProperties} - multi-agent threshold</li>
 * <li>{@link ProviderProperties} - per-provider credentials and endpoints</li>
 * <li>{@link CrewProperties}, {@link RagProperties} - external
 * collaborators</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "router")
@Data
public class RouterProperties {

    private RegistryProperties registry = new RegistryProperties();
    private UsageProperties usage = new UsageProperties();
    private BlacklistProperties blacklist = new BlacklistProperties();
    private RoutingProperties routing = new RoutingProperties();
    private ClassifierProperties classifier = new ClassifierProperties();
    private Map<String, ProviderProperties> providers = new HashMap<>();
    private LlmProperties llm = new LlmProperties();
    private CrewProperties crew = new CrewProperties();
    private RagProperties rag = new RagProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class RegistryProperties {
        private String location = "classpath:models.json";
    }

    @Data
    public static class UsageProperties {
        private Duration minuteWindow = Duration.ofMinutes(1);
        private Duration dayWindow = Duration.ofDays(1);
    }

    @Data
    public static class BlacklistProperties {
        private Duration quotaBan = Duration.ofMinutes(5);
        private Duration authBan = Duration.ofHours(6);
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class RoutingProperties {
        private int maxModelAttempts = 5;
        private int transientRetries = 1;
        private Duration requestTimeout = Duration.ofSeconds(60);
        private String directTaskType = "dialog";
        private String multiAgentTaskType = "dialog";
        private String systemPrompt = "You are a helpful assistant.";
    }

    @Data
    public static class ClassifierProperties {
        private int multiAgentThreshold = 3;
    }

    @Data
    public static class ProviderProperties {
        /** Explicit key; wins over {@link #apiKeyEnv}. */
        private String apiKey;
        /** Name of the environment variable holding the key. */
        private String apiKeyEnv;
        private String baseUrl;
        /** Wire protocol: {@code openai} (any compatible endpoint) or {@code anthropic}. */
        private String protocol = "openai";
    }

    @Data
    public static class LlmProperties {
        private double temperature = 0.5;
        private int maxOutputTokens = 2000;
    }

    @Data
    public static class CrewProperties {
        private boolean enabled = false;
        private String url = "http://localhost:5051";
        private String apiKey;
    }

    @Data
    public static class RagProperties {
        private boolean enabled = false;
        private String url = "http://localhost:9621";
        private String apiKey;
        private String queryMode = "hybrid";
        private int timeoutSeconds = 10;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
