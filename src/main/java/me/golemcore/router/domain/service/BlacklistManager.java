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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.BlacklistEntry;
import me.golemcore.router.domain.model.FailureKind;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Temporary, self-expiring bans of models that failed upstream.
 *
 * <p>
 * Expiry is lazy: an entry past its {@code bannedUntil} is treated as absent
 * by every read. A background sweep removes such entries periodically, which
 * only matters for memory, never for correctness.
 *
 * <p>
 * Ban policy for provider failures:
 * <ul>
 * <li>{@link FailureKind#QUOTA_EXCEEDED} - short ban
 * ({@code router.blacklist.quota-ban}, 5 minutes by default)</li>
 * <li>{@link FailureKind#AUTH_ERROR} - long ban
 * ({@code router.blacklist.auth-ban}, 6 hours by default), it will not fix
 * itself</li>
 * <li>{@link FailureKind#TRANSIENT} - no ban</li>
 * </ul>
 *
 * @since 1.0
 */
@Service
@Slf4j
public class BlacklistManager {

    private static final String LOG_PREFIX = "[Blacklist]";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final Clock clock;
    private final RouterProperties.BlacklistProperties settings;
    private final Map<String, BlacklistEntry> entries = new ConcurrentHashMap<>();

    private final ScheduledExecutorService sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "blacklist-sweep");
        t.setDaemon(true);
        return t;
    });

    public BlacklistManager(Clock clock, RouterProperties properties) {
        this.clock = clock;
        this.settings = properties.getBlacklist();
    }

    @PostConstruct
    void init() {
        long intervalMs = settings.getSweepInterval().toMillis();
        if (intervalMs > 0) {
            sweepExecutor.scheduleAtFixedRate(this::sweepExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
    }

    @PreDestroy
    void destroy() {
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Ban a model for {@code duration}, replacing any existing ban.
     */
    public void blacklist(String modelId, Duration duration, String reason) {
        blacklist(modelId, duration, reason, null);
    }

    /**
     * Ban a model according to the failure policy.
     *
     * @return {@code true} if a ban was recorded, {@code false} for failures
     *         that do not blacklist
     */
    public boolean blacklist(String modelId, FailureKind kind, String reason) {
        Duration duration = switch (kind) {
        case QUOTA_EXCEEDED -> settings.getQuotaBan();
        case AUTH_ERROR -> settings.getAuthBan();
        case TRANSIENT -> null;
        };
        if (duration == null) {
            return false;
        }
        blacklist(modelId, duration, reason, kind);
        return true;
    }

    private void blacklist(String modelId, Duration duration, String reason, FailureKind kind) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Ban duration must not be negative: " + duration);
        }
        Instant bannedUntil = clock.instant().plus(duration);
        entries.put(modelId, new BlacklistEntry(modelId, bannedUntil, reason, kind));
        log.warn("{} Model {} banned for {}s: {}", LOG_PREFIX, modelId, duration.toSeconds(), reason);
    }

    public boolean isBlacklisted(String modelId) {
        BlacklistEntry entry = entries.get(modelId);
        return entry != null && entry.isActive(clock.instant());
    }

    /**
     * Remaining ban time in whole seconds (rounded up) for every currently
     * banned model.
     */
    public Map<String, Long> status() {
        Instant now = clock.instant();
        Map<String, Long> result = new TreeMap<>();
        for (BlacklistEntry entry : entries.values()) {
            if (entry.isActive(now)) {
                long remainingMs = Duration.between(now, entry.bannedUntil()).toMillis();
                result.put(entry.modelId(), (remainingMs + 999) / 1000);
            }
        }
        return result;
    }

    /**
     * Active entries, soonest expiry first.
     */
    public List<BlacklistEntry> entries() {
        Instant now = clock.instant();
        List<BlacklistEntry> active = new ArrayList<>();
        for (BlacklistEntry entry : entries.values()) {
            if (entry.isActive(now)) {
                active.add(entry);
            }
        }
        active.sort(Comparator.comparing(BlacklistEntry::bannedUntil).thenComparing(BlacklistEntry::modelId));
        return active;
    }

    /**
     * Lift a ban before it expires.
     *
     * @return {@code true} if an active ban was removed
     */
    public boolean lift(String modelId) {
        BlacklistEntry removed = entries.remove(modelId);
        boolean wasActive = removed != null && removed.isActive(clock.instant());
        if (wasActive) {
            log.info("{} Ban on {} lifted manually", LOG_PREFIX, modelId);
        }
        return wasActive;
    }

    /**
     * Drop expired entries.
     *
     * @return number of removed entries
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isActive(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("{} Swept {} expired entries", LOG_PREFIX, removed);
        }
        return removed;
    }
}
