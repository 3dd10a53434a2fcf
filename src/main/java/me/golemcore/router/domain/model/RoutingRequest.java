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
import lombok.Value;

import java.time.Duration;

/**
 * Incoming chat/task request.
 *
 * <p>
 * {@code taskType} pins the registry task type; when {@code null} the router
 * picks the configured default for the chosen path. {@code timeout} bounds the
 * whole routing including retries; when {@code null} the configured request
 * timeout applies.
 */
@Value
@Builder
public class RoutingRequest {

    String message;
    TaskType taskType;
    Duration timeout;

    public static RoutingRequest of(String message) {
        return RoutingRequest.builder().message(message).build();
    }
}
