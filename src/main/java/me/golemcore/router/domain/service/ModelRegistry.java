package me.golemcore.router.domain.service;

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

import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.ModelRegistryException;
import me.golemcore.router.domain.model.TaskType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalogue of upstream models, built once at startup.
 *
 * <p>
 * Per-task views are precomputed and sorted by priority ascending (lower is
 * tried first), then {@code baseScore} descending, then id. The registry has
 * no mutation operations.
 *
 * @since 1.0
 * @see me.golemcore.router.infrastructure.config.ModelRegistryLoader
 */
public final class ModelRegistry {

    static final Comparator<ModelDescriptor> SELECTION_ORDER = Comparator
            .comparingInt(ModelDescriptor::getPriority)
            .thenComparing(Comparator.comparingDouble(ModelDescriptor::getBaseScore).reversed())
            .thenComparing(ModelDescriptor::getId);

    private final Map<String, ModelDescriptor> modelsById;
    private final Map<TaskType, List<ModelDescriptor>> modelsByTask;

    private ModelRegistry(Map<String, ModelDescriptor> modelsById) {
        this.modelsById = Collections.unmodifiableMap(modelsById);
        Map<TaskType, List<ModelDescriptor>> byTask = new EnumMap<>(TaskType.class);
        for (TaskType taskType : TaskType.values()) {
            List<ModelDescriptor> models = new ArrayList<>();
            for (ModelDescriptor model : modelsById.values()) {
                if (model.supports(taskType)) {
                    models.add(model);
                }
            }
            models.sort(SELECTION_ORDER);
            byTask.put(taskType, List.copyOf(models));
        }
        this.modelsByTask = Collections.unmodifiableMap(byTask);
    }

    /**
     * Build a registry from already validated descriptors.
     *
     * @throws ModelRegistryException
     *             on duplicate ids
     */
    public static ModelRegistry of(List<ModelDescriptor> models) {
        Map<String, ModelDescriptor> byId = new LinkedHashMap<>();
        for (ModelDescriptor model : models) {
            if (byId.putIfAbsent(model.getId(), model) != null) {
                throw new ModelRegistryException("Duplicate model id: " + model.getId());
            }
        }
        return new ModelRegistry(byId);
    }

    /**
     * Models registered for a task type, in selection order.
     */
    public List<ModelDescriptor> modelsForTask(TaskType taskType) {
        return modelsByTask.getOrDefault(taskType, List.of());
    }

    public Optional<ModelDescriptor> find(String modelId) {
        return Optional.ofNullable(modelsById.get(modelId));
    }

    /**
     * @throws IllegalArgumentException
     *             if the model is not registered
     */
    public ModelDescriptor require(String modelId) {
        ModelDescriptor model = modelsById.get(modelId);
        if (model == null) {
            throw new IllegalArgumentException("Unknown model: " + modelId);
        }
        return model;
    }

    public List<ModelDescriptor> all() {
        List<ModelDescriptor> models = new ArrayList<>(modelsById.values());
        models.sort(SELECTION_ORDER);
        return models;
    }

    public int size() {
        return modelsById.size();
    }
}
