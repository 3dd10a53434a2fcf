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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.ModelLimits;
import me.golemcore.router.domain.model.ModelRegistryException;
import me.golemcore.router.domain.model.TaskType;
import me.golemcore.router.domain.service.ModelRegistry;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the model catalogue from {@code router.registry.location} (any Spring
 * resource, {@code classpath:models.json} by default).
 *
 * <p>
 * The file is a JSON array of records:
 *
 * <pre>
 * { "id": "gemini/gemini-1.5-flash", "provider": "gemini",
 *   "task_types": ["dialog", "code"], "priority": 3,
 *   "rpm": 15, "tpm": 2500000, "rpd": 50 }
 * </pre>
 *
 * Optional keys: {@code display_name}, {@code base_score}. Every malformed
 * entry fails the load with {@link ModelRegistryException}; nothing is
 * validated lazily at request time.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelRegistryLoader {

    private static final TypeReference<List<ModelEntry>> ENTRY_LIST_TYPE = new TypeReference<>() {
    };

    private final RouterProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    /**
     * Load and validate the configured registry.
     */
    public ModelRegistry load() {
        String location = properties.getRegistry().getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ModelRegistryException("Model registry not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            String json = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            ModelRegistry registry = parse(json);
            log.info("[Registry] Loaded {} models from {}", registry.size(), location);
            return registry;
        } catch (IOException e) {
            throw new ModelRegistryException("Failed to read model registry " + location + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse and validate registry JSON.
     */
    public ModelRegistry parse(String json) {
        List<ModelEntry> entries;
        try {
            entries = objectMapper.readValue(json, ENTRY_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new ModelRegistryException("Malformed model registry JSON: " + e.getOriginalMessage(), e);
        }
        if (entries == null) {
            throw new ModelRegistryException("Model registry must be a JSON array");
        }

        List<ModelDescriptor> models = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            ModelDescriptor model = toDescriptor(i, entries.get(i));
            if (!seenIds.add(model.getId())) {
                throw new ModelRegistryException("Duplicate model id: " + model.getId());
            }
            models.add(model);
        }
        return ModelRegistry.of(models);
    }

    private ModelDescriptor toDescriptor(int index, ModelEntry entry) {
        if (entry == null) {
            throw invalid(index, null, "entry is null");
        }
        String id = entry.getId();
        if (id == null || id.isBlank()) {
            throw invalid(index, null, "missing id");
        }
        if (entry.getProvider() == null || entry.getProvider().isBlank()) {
            throw invalid(index, id, "missing provider");
        }
        if (entry.getPriority() == null) {
            throw invalid(index, id, "missing priority");
        }
        if (entry.getRpm() == null || entry.getTpm() == null || entry.getRpd() == null) {
            throw invalid(index, id, "missing limits (rpm, tpm and rpd are required)");
        }
        if (entry.getTaskTypes() == null || entry.getTaskTypes().isEmpty()) {
            throw invalid(index, id, "task_types must not be empty");
        }

        ModelLimits limits;
        try {
            limits = new ModelLimits(entry.getRpm(), entry.getTpm(), entry.getRpd());
        } catch (IllegalArgumentException e) {
            throw invalid(index, id, e.getMessage());
        }

        ModelDescriptor.ModelDescriptorBuilder builder = ModelDescriptor.builder()
                .id(id.trim())
                .provider(entry.getProvider().trim())
                .displayName(entry.getDisplayName() != null ? entry.getDisplayName() : id.trim())
                .priority(entry.getPriority())
                .baseScore(entry.getBaseScore() != null ? entry.getBaseScore() : 0.0)
                .limits(limits);
        for (String taskType : entry.getTaskTypes()) {
            try {
                builder.taskType(TaskType.fromWireName(taskType));
            } catch (IllegalArgumentException e) {
                throw invalid(index, id, e.getMessage());
            }
        }
        return builder.build();
    }

    private ModelRegistryException invalid(int index, String id, String problem) {
        String where = id != null ? "'" + id + "'" : "#" + index;
        return new ModelRegistryException("Invalid model registry entry " + where + ": " + problem);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelEntry {
        private String id;
        private String provider;
        @JsonProperty("display_name")
        private String displayName;
        @JsonProperty("task_types")
        private List<String> taskTypes;
        private Integer priority;
        @JsonProperty("base_score")
        private Double baseScore;
        private Integer rpm;
        private Long tpm;
        private Integer rpd;
    }
}
