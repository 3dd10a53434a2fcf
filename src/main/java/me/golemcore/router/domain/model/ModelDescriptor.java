package me.golemcore.router.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Immutable description of an upstream model as declared in the registry.
 *
 * <p>
 * Ordering convention: a <b>lower</b> {@code priority} value is tried first.
 * Among equal priorities the higher {@code baseScore} wins, then the id in
 * natural order.
 *
 * @since 1.0
 */
@Value
@Builder
public class ModelDescriptor {

    String id;
    String provider;
    String displayName;
    @Singular
    Set<TaskType> taskTypes;
    int priority;
    double baseScore;
    ModelLimits limits;

    public boolean supports(TaskType taskType) {
        return taskTypes.contains(taskType);
    }

    /**
     * Model name as the provider knows it: the id without its
     * {@code provider/} prefix.
     */
    public String getProviderModelName() {
        String prefix = provider + "/";
        return id.startsWith(prefix) ? id.substring(prefix.length()) : id;
    }
}
