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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of work a model is registered for. Wire names are lowercase
 * ({@code "dialog"}, {@code "short_answer"}).
 */
public enum TaskType {

    SIMPLE("simple"), DIALOG("dialog"), CODE("code"), SUMMARIZE("summarize"), VISION("vision"), LOOKUP(
            "lookup"), SHORT_ANSWER("short_answer"), CREATIVE("creative"), COMPLEX("complex");

    private final String wireName;

    TaskType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve a wire name (case-insensitive).
     *
     * @throws IllegalArgumentException
     *             if the name does not match any task type
     */
    @JsonCreator
    public static TaskType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TaskType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + value);
    }
}
