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
import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.ModelLimits;
import me.golemcore.router.domain.model.UsageCounters;
import me.golemcore.router.domain.model.UsageReservation;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model consumption counters over three fixed windows: requests per
 * minute, tokens per minute and requests per day.
 *
 * <p>
 * Windows are fixed, not sliding. A window whose
 * {@code now - windowStart >= windowLength} is stale: it counts as zero on
 * read and is restarted at {@code now} on the next write. A window starts at
 * the first use after it expired, so the day window is 24h from that use
 * rather than a calendar day.
 *
 * <p>
 * Each model's counters are guarded by their own monitor.
 * {@link #tryReserve(String, long)} runs the limit check and the increment in
 * one critical section so concurrent callers can never jointly overshoot a
 * limit. No I/O happens while a monitor is held.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class UsageLedger {

    private static final String LOG_PREFIX = "[Ledger]";

    private final ModelRegistry registry;
    private final Clock clock;
    private final Duration minuteWindow;
    private final Duration dayWindow;

    private final Map<String, ModelUsageWindow> windows = new ConcurrentHashMap<>();

    public UsageLedger(ModelRegistry registry, Clock clock, RouterProperties properties) {
        this.registry = registry;
        this.clock = clock;
        this.minuteWindow = properties.getUsage().getMinuteWindow();
        this.dayWindow = properties.getUsage().getDayWindow();
    }

    /**
     * Record one request of {@code tokens} tokens against the model,
     * unconditionally.
     */
    public void registerUse(String modelId, long tokens) {
        requireTokens(tokens);
        registry.require(modelId);
        ModelUsageWindow window = resolveWindow(modelId);
        synchronized (window) {
            Instant now = clock.instant();
            window.rollOver(now, minuteWindow, dayWindow);
            window.increment(tokens);
        }
    }

    /**
     * Whether one more request of {@code tokens} tokens keeps every counter at
     * or below its limit. Read-only: stale windows are treated as zero but not
     * reset.
     */
    public boolean canUse(String modelId, long tokens) {
        requireTokens(tokens);
        ModelLimits limits = registry.require(modelId).getLimits();
        ModelUsageWindow window = windows.get(modelId);
        if (window == null) {
            return fits(limits, 0, 0, 0, tokens);
        }
        synchronized (window) {
            Instant now = clock.instant();
            return fits(limits,
                    window.effectiveRpm(now, minuteWindow),
                    window.effectiveTpm(now, minuteWindow),
                    window.effectiveRpd(now, dayWindow),
                    tokens);
        }
    }

    /**
     * Check and register in one step.
     *
     * @return {@code true} if the use was registered, {@code false} if it would
     *         have exceeded a limit (nothing is recorded then)
     */
    public boolean tryRegisterUse(String modelId, long tokens) {
        return tryReserve(modelId, tokens).isPresent();
    }

    /**
     * Check and register in one step, returning a handle that can later
     * {@linkplain #refund(UsageReservation) refund} the use.
     *
     * @return the reservation, or empty if the use would have exceeded a limit
     *         (nothing is recorded then)
     */
    public Optional<UsageReservation> tryReserve(String modelId, long tokens) {
        requireTokens(tokens);
        ModelLimits limits = registry.require(modelId).getLimits();
        ModelUsageWindow window = resolveWindow(modelId);
        synchronized (window) {
            Instant now = clock.instant();
            window.rollOver(now, minuteWindow, dayWindow);
            if (!fits(limits, window.rpmCount, window.tpmCount, window.rpdCount, tokens)) {
                log.debug("{} Use of {} rejected: rpm={}/{}, tpm={}+{}/{}, rpd={}/{}", LOG_PREFIX, modelId,
                        window.rpmCount, limits.rpm(), window.tpmCount, tokens, limits.tpm(),
                        window.rpdCount, limits.rpd());
                return Optional.empty();
            }
            window.increment(tokens);
            return Optional.of(new UsageReservation(modelId, tokens,
                    window.rpmWindowStart, window.tpmWindowStart, window.rpdWindowStart));
        }
    }

    /**
     * Give back a reserved use whose request never reached the provider.
     * Only windows that are still the ones the use was counted in are
     * decremented; a window restarted since then holds other requests and is
     * left untouched. Counters never go below zero.
     */
    public void refund(UsageReservation reservation) {
        requireTokens(reservation.tokens());
        ModelUsageWindow window = windows.get(reservation.modelId());
        if (window == null) {
            return;
        }
        synchronized (window) {
            window.decrement(reservation);
        }
        log.debug("{} Refunded unsent request on {} ({} tokens)", LOG_PREFIX, reservation.modelId(),
                reservation.tokens());
    }

    /**
     * Snapshot of the model's counters. Stale windows are reset first.
     */
    public UsageCounters usage(String modelId) {
        registry.require(modelId);
        ModelUsageWindow window = windows.get(modelId);
        if (window == null) {
            return UsageCounters.empty(modelId);
        }
        synchronized (window) {
            window.rollOver(clock.instant(), minuteWindow, dayWindow);
            return window.snapshot(modelId);
        }
    }

    /**
     * Snapshots for every registered model, keyed by id.
     */
    public Map<String, UsageCounters> usageAll() {
        Map<String, UsageCounters> result = new TreeMap<>();
        for (ModelDescriptor model : registry.all()) {
            result.put(model.getId(), usage(model.getId()));
        }
        return result;
    }

    /**
     * Zero all counters of a model. The counters object itself is kept.
     */
    public void reset(String modelId) {
        registry.require(modelId);
        ModelUsageWindow window = windows.get(modelId);
        if (window == null) {
            return;
        }
        synchronized (window) {
            window.clear();
        }
        log.info("{} Counters of {} reset", LOG_PREFIX, modelId);
    }

    private ModelUsageWindow resolveWindow(String modelId) {
        return windows.computeIfAbsent(modelId, id -> new ModelUsageWindow());
    }

    private static boolean fits(ModelLimits limits, long rpm, long tpm, long rpd, long tokens) {
        return rpm + 1 <= limits.rpm()
                && tpm + tokens <= limits.tpm()
                && rpd + 1 <= limits.rpd();
    }

    private static void requireTokens(long tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("Token count must not be negative: " + tokens);
        }
    }

    private static boolean expired(Instant start, Instant now, Duration length) {
        return start == null || Duration.between(start, now).compareTo(length) >= 0;
    }

    /**
     * Mutable counters of one model. Every access holds the instance monitor.
     */
    private static final class ModelUsageWindow {

        private int rpmCount;
        private Instant rpmWindowStart;
        private long tpmCount;
        private Instant tpmWindowStart;
        private int rpdCount;
        private Instant rpdWindowStart;

        void rollOver(Instant now, Duration minute, Duration day) {
            if (expired(rpmWindowStart, now, minute)) {
                rpmCount = 0;
                rpmWindowStart = now;
            }
            if (expired(tpmWindowStart, now, minute)) {
                tpmCount = 0;
                tpmWindowStart = now;
            }
            if (expired(rpdWindowStart, now, day)) {
                rpdCount = 0;
                rpdWindowStart = now;
            }
        }

        int effectiveRpm(Instant now, Duration minute) {
            return expired(rpmWindowStart, now, minute) ? 0 : rpmCount;
        }

        long effectiveTpm(Instant now, Duration minute) {
            return expired(tpmWindowStart, now, minute) ? 0 : tpmCount;
        }

        int effectiveRpd(Instant now, Duration day) {
            return expired(rpdWindowStart, now, day) ? 0 : rpdCount;
        }

        void increment(long tokens) {
            rpmCount++;
            tpmCount += tokens;
            rpdCount++;
        }

        void decrement(UsageReservation reservation) {
            if (reservation.rpmWindowStart().equals(rpmWindowStart)) {
                rpmCount = Math.max(0, rpmCount - 1);
            }
            if (reservation.tpmWindowStart().equals(tpmWindowStart)) {
                tpmCount = Math.max(0, tpmCount - reservation.tokens());
            }
            if (reservation.rpdWindowStart().equals(rpdWindowStart)) {
                rpdCount = Math.max(0, rpdCount - 1);
            }
        }

        void clear() {
            rpmCount = 0;
            tpmCount = 0;
            rpdCount = 0;
        }

        UsageCounters snapshot(String modelId) {
            return UsageCounters.builder()
                    .modelId(modelId)
                    .rpmCount(rpmCount)
                    .rpmWindowStart(rpmWindowStart)
                    .tpmCount(tpmCount)
                    .tpmWindowStart(tpmWindowStart)
                    .rpdCount(rpdCount)
                    .rpdWindowStart(rpdWindowStart)
                    .build();
        }
    }
}
