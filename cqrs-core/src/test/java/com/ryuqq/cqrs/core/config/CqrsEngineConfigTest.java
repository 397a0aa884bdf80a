package com.ryuqq.cqrs.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CqrsEngineConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CqrsEngineConfigTest {

    @Test
    void defaults_MatchDocumentedValues() {
        // When
        CqrsEngineConfig config = CqrsEngineConfig.defaults();

        // Then
        assertEquals(50, config.snapshotInterval());
        assertEquals(3, config.maxRetries());
        assertEquals(100, config.baseRetryDelayMs());
        assertEquals(5000, config.maxRetryDelayMs());
        assertEquals(0.1, config.retryJitterFactor());
        assertEquals(300_000, config.deduplicationWindowMs());
        assertEquals(1000, config.deadLetterMaxSize());
        assertTrue(config.queryCacheEnabled());
        assertEquals(30_000, config.queryCacheTtlMs());
        assertEquals(1000, config.sagaHistoryLimit());
        assertEquals(new CqrsEngineConfig(), config);
    }

    @Test
    void withMethods_ChangeOnlyOneField() {
        // Given
        CqrsEngineConfig config = CqrsEngineConfig.defaults();

        // When
        CqrsEngineConfig tuned = config
            .withSnapshotInterval(2)
            .withMaxRetries(0)
            .withBaseRetryDelayMs(0)
            .withRetryJitterFactor(0.0)
            .withQueryCacheEnabled(false);

        // Then
        assertEquals(2, tuned.snapshotInterval());
        assertEquals(0, tuned.maxRetries());
        assertEquals(0, tuned.baseRetryDelayMs());
        assertEquals(0.0, tuned.retryJitterFactor());
        assertFalse(tuned.queryCacheEnabled());
        assertEquals(config.maxRetryDelayMs(), tuned.maxRetryDelayMs());
        assertEquals(config.deduplicationWindowMs(), tuned.deduplicationWindowMs());
        assertEquals(50, config.snapshotInterval());
    }

    @Test
    void constructor_ZeroSnapshotInterval_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CqrsEngineConfig.defaults().withSnapshotInterval(0)
        );
        assertTrue(exception.getMessage().contains("snapshotInterval must be positive"));
        assertTrue(exception.getMessage().contains("current: 0"));
    }

    @Test
    void constructor_MaxDelayBelowBase_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> CqrsEngineConfig.defaults().withMaxRetryDelayMs(50)
        );
    }

    @Test
    void constructor_JitterOutOfRange_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> CqrsEngineConfig.defaults().withRetryJitterFactor(1.5));
        assertThrows(IllegalArgumentException.class, () -> CqrsEngineConfig.defaults().withRetryJitterFactor(-0.1));
    }

    @Test
    void constructor_NegativeCounts_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> CqrsEngineConfig.defaults().withMaxRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> CqrsEngineConfig.defaults().withSagaHistoryLimit(-1));
        assertThrows(IllegalArgumentException.class, () -> CqrsEngineConfig.defaults().withDeadLetterMaxSize(0));
        assertThrows(IllegalArgumentException.class, () -> CqrsEngineConfig.defaults().withDeduplicationWindowMs(0));
        assertThrows(IllegalArgumentException.class, () -> CqrsEngineConfig.defaults().withQueryCacheTtlMs(0));
    }

    @Test
    void constructor_ZeroSagaHistory_IsAllowed() {
        // When & Then
        assertDoesNotThrow(() -> CqrsEngineConfig.defaults().withSagaHistoryLimit(0));
    }
}
