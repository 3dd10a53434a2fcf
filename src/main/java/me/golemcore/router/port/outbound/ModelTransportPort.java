package me.golemcore.router.port.outbound;

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

import me.golemcore.router.domain.model.DispatchOutcome;
import me.golemcore.router.domain.model.DispatchRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the single-call path: sends one request to one provider model.
 *
 * <p>
 * Implementations complete the future with a {@link DispatchOutcome} for
 * every provider failure instead of completing it exceptionally, and must
 * report whether the request was actually sent.
 */
public interface ModelTransportPort {

    /**
     * Executes a chat completion against {@code request.getModel()}.
     */
    CompletableFuture<DispatchOutcome> dispatch(DispatchRequest request);
}
