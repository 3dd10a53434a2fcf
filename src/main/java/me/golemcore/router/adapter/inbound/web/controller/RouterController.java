package me.golemcore.router.adapter.inbound.web.controller;

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
import me.golemcore.router.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.router.adapter.inbound.web.dto.ClassificationResponse;
import me.golemcore.router.adapter.inbound.web.dto.ModelResponse;
import me.golemcore.router.adapter.inbound.web.dto.RoutingResponse;
import me.golemcore.router.domain.model.ComplexityScore;
import me.golemcore.router.domain.model.DispatchAttempt;
import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.RouterState;
import me.golemcore.router.domain.model.RoutingRequest;
import me.golemcore.router.domain.model.RoutingResult;
import me.golemcore.router.domain.model.TaskType;
import me.golemcore.router.domain.model.UsageCounters;
import me.golemcore.router.domain.service.BlacklistManager;
import me.golemcore.router.domain.service.ModelRegistry;
import me.golemcore.router.domain.service.RequestRouter;
import me.golemcore.router.domain.service.UsageLedger;
import me.golemcore.router.routing.ComplexityClassifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Chat routing and diagnostics endpoints.
 *
 * <p>
 * Model ids contain a slash, so they are passed as the {@code model} query
 * parameter rather than a path segment.
 */
@RestController
@RequestMapping("/api/router")
@RequiredArgsConstructor
public class RouterController {

    private final RequestRouter requestRouter;
    private final ComplexityClassifier complexityClassifier;
    private final ModelRegistry modelRegistry;
    private final UsageLedger usageLedger;
    private final BlacklistManager blacklistManager;

    @PostMapping("/chat")
    public Mono<ResponseEntity<RoutingResponse>> chat(@RequestBody ChatRequest request) {
        RoutingRequest routingRequest = toRoutingRequest(request);
        return Mono.fromCallable(() -> requestRouter.route(routingRequest))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(toResponse(result)));
    }

    @GetMapping("/models")
    public Mono<ResponseEntity<List<ModelResponse>>> getModels() {
        List<ModelResponse> models = modelRegistry.all().stream()
                .map(this::toModelResponse)
                .toList();
        return Mono.just(ResponseEntity.ok(models));
    }

    @GetMapping("/classify")
    public Mono<ResponseEntity<ClassificationResponse>> classify(@RequestParam String text) {
        ComplexityScore score = complexityClassifier.analyze(text);
        return Mono.just(ResponseEntity.ok(ClassificationResponse.builder()
                .complexity(score.value())
                .requiresMultiAgent(score.requiresMultiAgent())
                .category(score.category().name().toLowerCase(Locale.ROOT))
                .ambiguous(score.ambiguous())
                .build()));
    }

    @GetMapping("/blacklist")
    public Mono<ResponseEntity<Map<String, Long>>> getBlacklist() {
        return Mono.just(ResponseEntity.ok(blacklistManager.status()));
    }

    @DeleteMapping("/blacklist")
    public Mono<ResponseEntity<Void>> liftBlacklist(@RequestParam String model) {
        if (!blacklistManager.lift(model)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Model is not blacklisted: " + model);
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/usage")
    public Mono<ResponseEntity<Map<String, UsageCounters>>> getUsage() {
        return Mono.just(ResponseEntity.ok(usageLedger.usageAll()));
    }

    @GetMapping("/usage/model")
    public Mono<ResponseEntity<UsageCounters>> getModelUsage(@RequestParam String model) {
        requireKnownModel(model);
        return Mono.just(ResponseEntity.ok(usageLedger.usage(model)));
    }

    @PostMapping("/usage/reset")
    public Mono<ResponseEntity<Void>> resetUsage(@RequestParam String model) {
        requireKnownModel(model);
        usageLedger.reset(model);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private RoutingRequest toRoutingRequest(ChatRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
        TaskType taskType = null;
        if (request.getTaskType() != null && !request.getTaskType().isBlank()) {
            try {
                taskType = TaskType.fromWireName(request.getTaskType());
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
            }
        }
        Duration timeout = null;
        if (request.getTimeoutMs() != null) {
            if (request.getTimeoutMs() <= 0) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "timeoutMs must be positive");
            }
            timeout = Duration.ofMillis(request.getTimeoutMs());
        }
        return RoutingRequest.builder()
                .message(request.getMessage())
                .taskType(taskType)
                .timeout(timeout)
                .build();
    }

    private void requireKnownModel(String modelId) {
        if (modelRegistry.find(modelId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown model: " + modelId);
        }
    }

    private RoutingResponse toResponse(RoutingResult result) {
        ComplexityScore score = result.getScore();
        return RoutingResponse.builder()
                .status(result.getStatus().name().toLowerCase(Locale.ROOT))
                .content(result.getContent())
                .modelId(result.getModelId())
                .complexity(score != null ? score.value() : null)
                .category(score != null ? score.category().name().toLowerCase(Locale.ROOT) : null)
                .ambiguous(score != null && score.ambiguous())
                .multiAgent(result.isMultiAgent())
                .states(result.getStates().stream().map(RouterState::name).toList())
                .attempts(result.getAttempts().stream().map(this::toAttempt).toList())
                .message(result.getMessage())
                .build();
    }

    private RoutingResponse.Attempt toAttempt(DispatchAttempt attempt) {
        return RoutingResponse.Attempt.builder()
                .modelId(attempt.modelId())
                .multiAgent(attempt.multiAgent())
                .failure(attempt.failureKind() != null ? attempt.failureKind().name() : null)
                .sent(attempt.sent())
                .message(attempt.message())
                .build();
    }

    private ModelResponse toModelResponse(ModelDescriptor model) {
        return ModelResponse.builder()
                .id(model.getId())
                .provider(model.getProvider())
                .displayName(model.getDisplayName())
                .taskTypes(model.getTaskTypes().stream()
                        .map(TaskType::getWireName)
                        .sorted()
                        .collect(Collectors.toList()))
                .priority(model.getPriority())
                .baseScore(model.getBaseScore())
                .rpm(model.getLimits().rpm())
                .tpm(model.getLimits().tpm())
                .rpd(model.getLimits().rpd())
                .blacklisted(blacklistManager.isBlacklisted(model.getId()))
                .build();
    }
}
