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

import java.util.List;

/**
 * Typed result of {@code RequestRouter.route}. Failures such as
 * {@link RoutingStatus#NO_MODEL_AVAILABLE} are ordinary values here, not
 * exceptions.
 *
 * @since 1.0
 */
@Value
@Builder
public class RoutingResult {

    RoutingStatus status;
    String content;
    String modelId;
    ComplexityScore score;
    boolean multiAgent;
    @Singular
    List<DispatchAttempt> attempts;
    @Singular("transition")
    List<RouterState> states;
    String message;

    public boolean isResponded() {
        return status == RoutingStatus.RESPONDED;
    }

    public RouterState getFinalState() {
        return states.isEmpty() ? null : states.get(states.size() - 1);
    }
}
