package com.ryuqq.cqrs.testkit.contract;

import com.ryuqq.cqrs.core.model.IdempotencyKey;
import com.ryuqq.cqrs.core.outcome.CommandResult;
import com.ryuqq.cqrs.core.spi.DeduplicationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the {@link DeduplicationStore} SPI.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Same key returns the recorded result until it expires</li>
 *   <li>Expiry is exclusive: {@code expiresAt == now} is already expired</li>
 *   <li>Pruning removes expired entries only</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractDeduplicationStoreContractTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    protected DeduplicationStore deduplicationStore;

    protected abstract DeduplicationStore createDeduplicationStore();

    @BeforeEach
    void setUpDeduplicationStore() {
        deduplicationStore = createDeduplicationStore();
    }

    @Test
    void find_ReturnsRecordedResultBeforeExpiry() {
        // Given
        IdempotencyKey key = IdempotencyKey.of("req-1");
        CommandResult result = CommandResult.success("c-1", List.of(), 1);
        deduplicationStore.record(key, result, NOW.plusSeconds(60));

        // When / Then
        assertEquals(result, deduplicationStore.find(IdempotencyKey.of("req-1"), NOW).orElseThrow());
        assertTrue(deduplicationStore.find(IdempotencyKey.of("req-2"), NOW).isEmpty());
    }

    @Test
    void find_IgnoresExpiredEntries() {
        // Given
        IdempotencyKey key = IdempotencyKey.of("req-1");
        deduplicationStore.record(key, CommandResult.success("c-1", List.of(), 1), NOW.plusSeconds(60));

        // When / Then
        assertTrue(deduplicationStore.find(key, NOW.plusSeconds(60)).isEmpty());
        assertTrue(deduplicationStore.find(key, NOW.plusSeconds(61)).isEmpty());
    }

    @Test
    void pruneExpired_RemovesOnlyExpired() {
        // Given
        deduplicationStore.record(IdempotencyKey.of("old"), CommandResult.success("c-1", List.of(), 1), NOW.minusSeconds(1));
        deduplicationStore.record(IdempotencyKey.of("new"), CommandResult.success("c-2", List.of(), 1), NOW.plusSeconds(60));

        // When
        int removed = deduplicationStore.pruneExpired(NOW);

        // Then
        assertEquals(1, removed);
        assertEquals(1, deduplicationStore.size());
        assertTrue(deduplicationStore.find(IdempotencyKey.of("new"), NOW).isPresent());
    }

    @Test
    void record_ReplacesPreviousEntry() {
        // Given
        IdempotencyKey key = IdempotencyKey.of("req-1");
        deduplicationStore.record(key, CommandResult.success("c-1", List.of(), 1), NOW.plusSeconds(60));

        // When
        deduplicationStore.record(key, CommandResult.success("c-2", List.of(), 2), NOW.plusSeconds(60));

        // Then
        assertEquals("c-2", deduplicationStore.find(key, NOW).orElseThrow().commandId());
        assertEquals(1, deduplicationStore.size());
    }
}
