package com.ryuqq.cqrs.adapter.inmemory.dedup;

import com.ryuqq.cqrs.core.model.IdempotencyKey;
import com.ryuqq.cqrs.core.outcome.CommandResult;
import com.ryuqq.cqrs.core.spi.DeduplicationStore;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link DeduplicationStore} for testing and reference purposes.
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap} for lookups and writes</li>
 *   <li>{@link ConcurrentHashMap#remove(Object, Object)} during pruning, so an entry
 *       refreshed concurrently is never removed by a stale sweep</li>
 * </ul>
 *
 * <p>Expired entries stay in memory until {@link #pruneExpired(Instant)} runs,
 * but {@link #find(IdempotencyKey, Instant)} never returns them.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryDeduplicationStore implements DeduplicationStore {

    /**
     * IdempotencyKey → cached result with its expiry.
     */
    private final ConcurrentHashMap<IdempotencyKey, CachedResult> store = new ConcurrentHashMap<>();

    @Override
    public Optional<CommandResult> find(IdempotencyKey key, Instant now) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }

        CachedResult cached = store.get(key);
        if (cached == null || !cached.expiresAt().isAfter(now)) {
            return Optional.empty();
        }
        return Optional.of(cached.result());
    }

    @Override
    public void record(IdempotencyKey key, CommandResult result, Instant expiresAt) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt cannot be null");
        }
        store.put(key, new CachedResult(result, expiresAt));
    }

    @Override
    public int pruneExpired(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }

        int removed = 0;
        for (var entry : store.entrySet()) {
            if (!entry.getValue().expiresAt().isAfter(now) && store.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return store.size();
    }

    /**
     * Clears all cached results. Used for test cleanup.
     */
    public void clear() {
        store.clear();
    }

    private record CachedResult(CommandResult result, Instant expiresAt) {
    }
}
