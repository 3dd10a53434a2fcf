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
 * Result of one dispatch attempt: either success with content, or a typed
 * {@link FailureKind}.
 *
 * <p>
 * {@code sent} reports whether the request reached the provider. Quota is
 * consumed by sent requests, so an unsent attempt gives its registered usage
 * back to the ledger.
 */
@Value
@Builder
public class DispatchOutcome {

    String modelId;
    String content;
    FailureKind failureKind;
    String message;
    boolean sent;
    int inputTokens;
    int outputTokens;
    Duration latency;

    public boolean isSuccess() {
        return failureKind == null;
    }

    public static DispatchOutcome success(String modelId, String content) {
        return DispatchOutcome.builder()
                .modelId(modelId)
                .content(content)
                .sent(true)
                .build();
    }

    public static DispatchOutcome failure(String modelId, FailureKind kind, String message, boolean sent) {
        return DispatchOutcome.builder()
                .modelId(modelId)
                .failureKind(kind)
                .message(message)
                .sent(sent)
                .build();
    }
}
