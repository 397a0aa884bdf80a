package com.ryuqq.cqrs.core.spi;

import com.ryuqq.cqrs.core.model.IdempotencyKey;
import com.ryuqq.cqrs.core.outcome.CommandResult;

import java.time.Instant;
import java.util.Optional;

/**
 * Idempotency cache for successful command results.
 *
 * <p>Exact-match semantics: the key alone decides equivalence, never the payload.</p>
 *
 * <p><strong>Implementation Requirements:</strong> thread-safe.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DeduplicationStore {

    /**
     * Looks up an unexpired result.
     *
     * @param key idempotency key
     * @param now current time; entries with {@code expiresAt <= now} are treated as absent
     * @return the cached result, or empty
     */
    Optional<CommandResult> find(IdempotencyKey key, Instant now);

    /**
     * Records a result until {@code expiresAt}, replacing any previous entry.
     */
    void record(IdempotencyKey key, CommandResult result, Instant expiresAt);

    /**
     * Removes expired entries.
     *
     * @param now current time
     * @return number of entries removed
     */
    int pruneExpired(Instant now);

    int size();
}
