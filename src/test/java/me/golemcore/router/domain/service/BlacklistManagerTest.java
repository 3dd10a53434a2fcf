package me.golemcore.router.domain.service;

import me.golemcore.router.domain.model.BlacklistEntry;
import me.golemcore.router.domain.model.FailureKind;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlacklistManagerTest {

    private static final String MODEL_A = "gemini/a";
    private static final String MODEL_B = "gemini/b";

    private MutableClock clock;
    private BlacklistManager blacklistManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        blacklistManager = new BlacklistManager(clock, new RouterProperties());
    }

    // ===== TTL =====

    @Test
    void shouldBlacklistUntilTtlElapses() {
        blacklistManager.blacklist(MODEL_A, Duration.ofSeconds(60), "quota");

        assertTrue(blacklistManager.isBlacklisted(MODEL_A));
        clock.advance(Duration.ofSeconds(59));
        assertTrue(blacklistManager.isBlacklisted(MODEL_A));
        clock.advance(Duration.ofSeconds(1));
        assertFalse(blacklistManager.isBlacklisted(MODEL_A));
    }

    @Test
    void shouldNotBlacklistWithZeroDuration() {
        blacklistManager.blacklist(MODEL_A, Duration.ZERO, "noop");

        assertFalse(blacklistManager.isBlacklisted(MODEL_A));
    }

    @Test
    void shouldReplaceExistingBan() {
        blacklistManager.blacklist(MODEL_A, Duration.ofHours(1), "long");
        blacklistManager.blacklist(MODEL_A, Duration.ofSeconds(10), "short");

        clock.advance(Duration.ofSeconds(11));
        assertFalse(blacklistManager.isBlacklisted(MODEL_A));
    }

    @Test
    void shouldRejectNegativeDuration() {
        assertThrows(IllegalArgumentException.class,
                () -> blacklistManager.blacklist(MODEL_A, Duration.ofSeconds(-1), "bad"));
    }

    @Test
    void shouldReportUnknownModelAsNotBlacklisted() {
        assertFalse(blacklistManager.isBlacklisted("unknown/model"));
    }

    // ===== Failure policy =====

    @Test
    void shouldApplyShortBanForQuotaFailure() {
        assertTrue(blacklistManager.blacklist(MODEL_A, FailureKind.QUOTA_EXCEEDED, "429"));

        assertEquals(300L, blacklistManager.status().get(MODEL_A));
        assertEquals(FailureKind.QUOTA_EXCEEDED, blacklistManager.entries().get(0).failureKind());
    }

    @Test
    void shouldApplyLongBanForAuthFailure() {
        assertTrue(blacklistManager.blacklist(MODEL_A, FailureKind.AUTH_ERROR, "401"));

        clock.advance(Duration.ofHours(5));
        assertTrue(blacklistManager.isBlacklisted(MODEL_A));
        clock.advance(Duration.ofHours(1));
        assertFalse(blacklistManager.isBlacklisted(MODEL_A));
    }

    @Test
    void shouldNotBanForTransientFailure() {
        assertFalse(blacklistManager.blacklist(MODEL_A, FailureKind.TRANSIENT, "timeout"));

        assertFalse(blacklistManager.isBlacklisted(MODEL_A));
    }

    // ===== Status and maintenance =====

    @Test
    void shouldReportRemainingSecondsRoundedUp() {
        blacklistManager.blacklist(MODEL_A, Duration.ofSeconds(60), "quota");
        clock.advance(Duration.ofMillis(500));

        Map<String, Long> status = blacklistManager.status();

        assertEquals(1, status.size());
        assertEquals(60L, status.get(MODEL_A));
    }

    @Test
    void shouldOmitExpiredEntriesFromStatus() {
        blacklistManager.blacklist(MODEL_A, Duration.ofSeconds(10), "quota");
        blacklistManager.blacklist(MODEL_B, Duration.ofSeconds(100), "auth");
        clock.advance(Duration.ofSeconds(20));

        assertEquals(Map.of(MODEL_B, 80L), blacklistManager.status());
    }

    @Test
    void shouldListEntriesBySoonestExpiry() {
        blacklistManager.blacklist(MODEL_A, Duration.ofSeconds(100), "later");
        blacklistManager.blacklist(MODEL_B, Duration.ofSeconds(10), "sooner");

        List<BlacklistEntry> entries = blacklistManager.entries();

        assertEquals(MODEL_B, entries.get(0).modelId());
        assertEquals(MODEL_A, entries.get(1).modelId());
    }

    @Test
    void shouldLiftActiveBan() {
        blacklistManager.blacklist(MODEL_A, Duration.ofMinutes(5), "quota");

        assertTrue(blacklistManager.lift(MODEL_A));
        assertFalse(blacklistManager.isBlacklisted(MODEL_A));
        assertFalse(blacklistManager.lift(MODEL_A));
    }

    @Test
    void shouldSweepExpiredEntries() {
        blacklistManager.blacklist(MODEL_A, Duration.ofSeconds(10), "quota");
        blacklistManager.blacklist(MODEL_B, Duration.ofSeconds(100), "quota");
        clock.advance(Duration.ofSeconds(30));

        assertEquals(1, blacklistManager.sweepExpired());
        assertEquals(0, blacklistManager.sweepExpired());
        assertTrue(blacklistManager.isBlacklisted(MODEL_B));
    }
}
