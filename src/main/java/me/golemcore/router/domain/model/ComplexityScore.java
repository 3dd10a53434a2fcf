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

/**
 * Result of classifying a request.
 *
 * @param value
 *            complexity in {@code 1..5}
 * @param requiresMultiAgent
 *            whether the request should be handed to the multi-agent path
 * @param category
 *            detected request category
 * @param ambiguous
 *            simple and multi-step signals were both present; resolved
 *            towards the multi-agent path
 */
public record ComplexityScore(int value, boolean requiresMultiAgent, RequestCategory category, boolean ambiguous) {

    public static final int MIN = 1;
    public static final int MAX = 5;

    public ComplexityScore {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException("Complexity must be in " + MIN + ".." + MAX + ": " + value);
        }
    }
}
