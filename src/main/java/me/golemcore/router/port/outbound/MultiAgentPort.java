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
import me.golemcore.router.domain.model.MultiAgentTask;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the multi-agent execution engine. The router only decides whether
 * to hand a request off; crew construction and task graphs live behind this
 * port.
 */
public interface MultiAgentPort {

    /**
     * Runs the task with the model the router selected for it.
     */
    CompletableFuture<DispatchOutcome> execute(MultiAgentTask task);

    /**
     * Checks if the engine is configured. When it is not, the router degrades
     * to the single-call path.
     */
    boolean isAvailable();
}
