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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.TaskType;
import me.golemcore.router.port.outbound.CredentialPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the best eligible model for a task.
 *
 * <p>
 * Walks {@link ModelRegistry#modelsForTask(TaskType)} in priority order and
 * returns the first model that is not blacklisted, whose provider has
 * credentials, and that {@link UsageLedger#canUse(String, long)} admits. The
 * choice is deterministic for a given registry, ledger and blacklist state.
 *
 * <p>
 * Selection does not reserve quota. Callers re-validate with
 * {@link UsageLedger#tryReserve(String, long)} right before sending and
 * fail over if a concurrent caller took the last slot.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelSelector {

    private final ModelRegistry registry;
    private final UsageLedger usageLedger;
    private final BlacklistManager blacklistManager;
    private final CredentialPort credentialPort;

    /**
     * Select a model for the task.
     *
     * @return the first eligible model, or empty when none is available
     */
    public Optional<ModelDescriptor> select(TaskType taskType, long tokens) {
        return select(taskType, tokens, Set.of());
    }

    /**
     * Select a model for the task, skipping the ids in {@code excluded} (models
     * already tried for the current request).
     */
    public Optional<ModelDescriptor> select(TaskType taskType, long tokens, Set<String> excluded) {
        for (ModelDescriptor model : registry.modelsForTask(taskType)) {
            if (isEligible(model, tokens, excluded)) {
                log.debug("[Selector] Selected {} for {} ({} tokens)", model.getId(), taskType, tokens);
                return Optional.of(model);
            }
        }
        log.debug("[Selector] No model available for {} ({} tokens, excluded={})", taskType, tokens, excluded);
        return Optional.empty();
    }

    /**
     * All currently eligible models for the task, in selection order.
     */
    public List<ModelDescriptor> candidates(TaskType taskType, long tokens) {
        List<ModelDescriptor> result = new ArrayList<>();
        for (ModelDescriptor model : registry.modelsForTask(taskType)) {
            if (isEligible(model, tokens, Set.of())) {
                result.add(model);
            }
        }
        return result;
    }

    private boolean isEligible(ModelDescriptor model, long tokens, Set<String> excluded) {
        if (excluded.contains(model.getId())) {
            return false;
        }
        if (blacklistManager.isBlacklisted(model.getId())) {
            log.trace("[Selector] Skipping {}: blacklisted", model.getId());
            return false;
        }
        if (!credentialPort.hasCredentials(model.getProvider())) {
            log.trace("[Selector] Skipping {}: no credentials for provider {}", model.getId(), model.getProvider());
            return false;
        }
        if (!usageLedger.canUse(model.getId(), tokens)) {
            log.trace("[Selector] Skipping {}: over limit", model.getId());
            return false;
        }
        return true;
    }
}
