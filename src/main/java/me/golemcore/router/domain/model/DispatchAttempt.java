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
 * One try against one model, kept on the routing result for diagnostics.
 * {@code failureKind} is {@code null} for the successful attempt and for
 * attempts the ledger refused before sending.
 */
public record DispatchAttempt(String modelId, boolean multiAgent, FailureKind failureKind, boolean sent,
        String message) {
}
