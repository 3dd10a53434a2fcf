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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.ComplexityScore;
import me.golemcore.router.domain.model.DispatchAttempt;
import me.golemcore.router.domain.model.DispatchOutcome;
import me.golemcore.router.domain.model.DispatchRequest;
import me.golemcore.router.domain.model.FailureKind;
import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.MultiAgentTask;
import me.golemcore.router.domain.model.RouterState;
import me.golemcore.router.domain.model.RoutingRequest;
import me.golemcore.router.domain.model.RoutingResult;
import me.golemcore.router.domain.model.RoutingStatus;
import me.golemcore.router.domain.model.TaskType;
import me.golemcore.router.domain.model.UsageReservation;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.ContextPort;
import me.golemcore.router.port.outbound.ModelTransportPort;
import me.golemcore.router.port.outbound.MultiAgentPort;
import me.golemcore.router.routing.ComplexityClassifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes one request end to end: classify, pick the path, select a model,
 * dispatch and fail over.
 *
 * <p>
 * States advance {@code RECEIVED -> CLASSIFIED -> DISPATCHING} and then either
 * {@code RESPONDED} or {@code RETRYING -> DISPATCHING} until the attempt cap,
 * the candidate list or the deadline runs out, which ends in
 * {@code EXHAUSTED}. Quota and auth failures blacklist the model; transient
 * failures retry the same model a bounded number of times. Usage is
 * registered atomically right before each send and refunded when the request
 * never left this process.
 *
 * <p>
 * No lock is held while waiting on a provider, so a multi-agent collaborator
 * may call back into {@link #route(RoutingRequest)} for its sub-tasks.
 */
@Service
@Slf4j
public class RequestRouter {

    private static final int CHARS_PER_TOKEN = 4;
    private static final String CONTEXT_HEADER = "\n\nRelevant context:\n";

    private final ComplexityClassifier classifier;
    private final ModelSelector modelSelector;
    private final UsageLedger usageLedger;
    private final BlacklistManager blacklistManager;
    private final ModelTransportPort transport;
    private final MultiAgentPort multiAgentPort;
    private final ContextPort contextPort;
    private final RouterProperties properties;
    private final Clock clock;

    public RequestRouter(ComplexityClassifier classifier, ModelSelector modelSelector, UsageLedger usageLedger,
            BlacklistManager blacklistManager, ModelTransportPort transport, MultiAgentPort multiAgentPort,
            ContextPort contextPort, RouterProperties properties, Clock clock) {
        this.classifier = classifier;
        this.modelSelector = modelSelector;
        this.usageLedger = usageLedger;
        this.blacklistManager = blacklistManager;
        this.transport = transport;
        this.multiAgentPort = multiAgentPort;
        this.contextPort = contextPort;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Route a request. Never throws for routing failures; they are reported
     * through {@link RoutingResult#getStatus()}.
     *
     * @throws IllegalArgumentException
     *             if the message is blank
     */
    public RoutingResult route(RoutingRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new IllegalArgumentException("Message must not be blank");
        }
        RoutingResult.RoutingResultBuilder result = RoutingResult.builder().transition(RouterState.RECEIVED);
        try {
            return runStateMachine(request, result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Router] Routing interrupted");
            return result.status(RoutingStatus.CANCELLED)
                    .transition(RouterState.EXHAUSTED)
                    .message("Routing was interrupted")
                    .build();
        }
    }

    /**
     * Estimated token count, {@code ceil(chars / 4)} over all parts.
     */
    public static int estimateTokens(String... parts) {
        long chars = 0;
        for (String part : parts) {
            if (part != null) {
                chars += part.length();
            }
        }
        return (int) Math.min(Integer.MAX_VALUE, (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    private RoutingResult runStateMachine(RoutingRequest request, RoutingResult.RoutingResultBuilder result)
            throws InterruptedException {
        RouterProperties.RoutingProperties routing = properties.getRouting();
        Duration timeout = request.getTimeout() != null ? request.getTimeout() : routing.getRequestTimeout();
        Instant deadline = clock.instant().plus(timeout);

        ComplexityScore score = classifier.analyze(request.getMessage());
        result.score(score).transition(RouterState.CLASSIFIED);

        boolean multiAgent = score.requiresMultiAgent();
        if (multiAgent && !multiAgentPort.isAvailable()) {
            log.warn("[Router] Multi-agent collaborator unavailable, degrading to direct path (complexity {})",
                    score.value());
            multiAgent = false;
        }
        result.multiAgent(multiAgent);

        TaskType taskType = resolveTaskType(request, multiAgent);
        String context = retrieveContext(request.getMessage(), deadline);
        String systemPrompt = buildSystemPrompt(context);
        int tokens = estimateTokens(systemPrompt, request.getMessage());
        log.debug("[Router] Classified: complexity={}, category={}, multiAgent={}, taskType={}, tokens={}",
                score.value(), score.category(), multiAgent, taskType.getWireName(), tokens);

        Attempt attempt = new Attempt(request.getMessage(), context, systemPrompt, score, multiAgent, tokens,
                deadline);
        Set<String> tried = new LinkedHashSet<>();
        FailureKind lastFailure = null;
        boolean candidatesLeft = true;

        while (tried.size() < routing.getMaxModelAttempts()) {
            result.transition(RouterState.DISPATCHING);
            if (isPast(deadline)) {
                break;
            }
            Optional<ModelDescriptor> candidate = modelSelector.select(taskType, tokens, tried);
            if (candidate.isEmpty()) {
                candidatesLeft = false;
                break;
            }
            ModelDescriptor model = candidate.get();
            tried.add(model.getId());

            DispatchOutcome outcome = attemptModel(model, attempt, result);
            if (outcome != null && outcome.isSuccess()) {
                log.info("[Router] Responded via {} ({} path, {} attempt(s))", model.getId(),
                        multiAgent ? "multi-agent" : "direct", tried.size());
                return result.status(RoutingStatus.RESPONDED)
                        .transition(RouterState.RESPONDED)
                        .content(outcome.getContent())
                        .modelId(model.getId())
                        .build();
            }
            if (outcome != null) {
                lastFailure = outcome.getFailureKind();
                blacklistManager.blacklist(model.getId(), outcome.getFailureKind(), outcome.getMessage());
            }
            result.transition(RouterState.RETRYING);
        }

        result.transition(RouterState.EXHAUSTED);
        if (isPast(deadline)) {
            log.warn("[Router] Deadline of {} exceeded after {} model(s)", timeout, tried.size());
            return result.status(RoutingStatus.DEADLINE_EXCEEDED)
                    .message("Request deadline of " + timeout.toMillis() + "ms exceeded")
                    .build();
        }
        if (!candidatesLeft || lastFailure == null) {
            log.warn("[Router] No model available for task type {} after {} attempt(s)",
                    taskType.getWireName(), tried.size());
            return result.status(RoutingStatus.NO_MODEL_AVAILABLE)
                    .message("No model available for task type " + taskType.getWireName())
                    .build();
        }
        log.warn("[Router] Attempt cap of {} models reached, last failure: {}",
                routing.getMaxModelAttempts(), lastFailure);
        return result.status(RoutingStatus.UPSTREAM_FAILURE)
                .message("All " + tried.size() + " attempted models failed, last failure: " + lastFailure)
                .build();
    }

    /**
     * Dispatch to one model with bounded transient retries. Returns
     * {@code null} when nothing was sent, e.g. the ledger rejected the use.
     */
    private DispatchOutcome attemptModel(ModelDescriptor model, Attempt attempt,
            RoutingResult.RoutingResultBuilder result) throws InterruptedException {
        int transientRetries = Math.max(0, properties.getRouting().getTransientRetries());
        DispatchOutcome outcome = null;
        for (int i = 0; i <= transientRetries; i++) {
            Duration remaining = remaining(attempt.deadline);
            if (remaining.isZero()) {
                return outcome;
            }
            Optional<UsageReservation> reservation = usageLedger.tryReserve(model.getId(), attempt.tokens);
            if (reservation.isEmpty()) {
                log.debug("[Router] Usage rejected for {}, failing over", model.getId());
                result.attempt(new DispatchAttempt(model.getId(), attempt.multiAgent, null, false,
                        "Usage limit reached"));
                return outcome;
            }

            outcome = send(model, attempt, remaining);
            if (!outcome.isSent()) {
                usageLedger.refund(reservation.get());
            }
            result.attempt(new DispatchAttempt(model.getId(), attempt.multiAgent, outcome.getFailureKind(),
                    outcome.isSent(), outcome.getMessage()));

            if (outcome.isSuccess() || outcome.getFailureKind() != FailureKind.TRANSIENT) {
                return outcome;
            }
            log.info("[Router] Transient failure from {} (try {}/{}): {}", model.getId(), i + 1,
                    transientRetries + 1, outcome.getMessage());
        }
        return outcome;
    }

    private DispatchOutcome send(ModelDescriptor model, Attempt attempt, Duration remaining)
            throws InterruptedException {
        CompletableFuture<DispatchOutcome> future;
        try {
            future = attempt.multiAgent
                    ? multiAgentPort.execute(MultiAgentTask.builder()
                            .message(attempt.message)
                            .context(attempt.context)
                            .score(attempt.score)
                            .model(model)
                            .timeout(remaining)
                            .build())
                    : transport.dispatch(DispatchRequest.builder()
                            .model(model)
                            .systemPrompt(attempt.systemPrompt)
                            .userMessage(attempt.message)
                            .estimatedTokens(attempt.tokens)
                            .timeout(remaining)
                            .build());
        } catch (RuntimeException e) {
            return failureFrom(model, e);
        }

        try {
            DispatchOutcome outcome = future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                return DispatchOutcome.failure(model.getId(), FailureKind.TRANSIENT, "Empty outcome", true);
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Router] {} timed out after {}ms", model.getId(), remaining.toMillis());
            return DispatchOutcome.failure(model.getId(), FailureKind.TRANSIENT,
                    "Timed out after " + remaining.toMillis() + "ms", true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failureFrom(model, cause);
        }
    }

    private DispatchOutcome failureFrom(ModelDescriptor model, Throwable error) {
        FailureKind kind = ProviderFailureClassifier.classify(error);
        boolean sent = ProviderFailureClassifier.wasSent(error);
        log.warn("[Router] {} failed ({}, sent={}): {}", model.getId(), kind, sent, error.getMessage());
        return DispatchOutcome.failure(model.getId(), kind, error.getMessage(), sent);
    }

    private String retrieveContext(String message, Instant deadline) throws InterruptedException {
        if (!contextPort.isAvailable()) {
            return "";
        }
        Duration budget = Duration.ofSeconds(properties.getRag().getTimeoutSeconds());
        Duration remaining = remaining(deadline);
        if (remaining.compareTo(budget) < 0) {
            budget = remaining;
        }
        CompletableFuture<String> future = null;
        try {
            future = contextPort.retrieve(message);
            String context = future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            return context != null ? context : "";
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Router] Context retrieval timed out after {}ms, continuing without context",
                    budget.toMillis());
            return "";
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[Router] Context retrieval failed, continuing without context: {}", e.getMessage());
            return "";
        }
    }

    private String buildSystemPrompt(String context) {
        String base = properties.getRouting().getSystemPrompt();
        if (context == null || context.isBlank()) {
            return base;
        }
        return base + CONTEXT_HEADER + context;
    }

    private TaskType resolveTaskType(RoutingRequest request, boolean multiAgent) {
        if (request.getTaskType() != null) {
            return request.getTaskType();
        }
        RouterProperties.RoutingProperties routing = properties.getRouting();
        return TaskType.fromWireName(multiAgent ? routing.getMultiAgentTaskType() : routing.getDirectTaskType());
    }

    private Duration remaining(Instant deadline) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private boolean isPast(Instant deadline) {
        return !clock.instant().isBefore(deadline);
    }

    private static final class Attempt {
        private final String message;
        private final String context;
        private final String systemPrompt;
        private final ComplexityScore score;
        private final boolean multiAgent;
        private final int tokens;
        private final Instant deadline;

        private Attempt(String message, String context, String systemPrompt, ComplexityScore score,
                boolean multiAgent, int tokens, Instant deadline) {
            this.message = message;
            this.context = context;
            this.systemPrompt = systemPrompt;
            this.score = score;
            this.multiAgent = multiAgent;
            this.tokens = tokens;
            this.deadline = deadline;
        }
    }
}
