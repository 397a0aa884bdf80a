package com.ryuqq.cqrs.core.spi;

import java.time.Instant;

/**
 * Point-in-time statistics of a dead letter queue.
 *
 * @param totalEntries entries held, resolved or not
 * @param unresolvedEntries entries awaiting action
 * @param oldestFailure earliest {@code failedAt}, null when empty
 * @param newestFailure latest {@code failedAt}, null when empty
 * @param averageRetryCount mean attempts per entry, 0 when empty
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DeadLetterQueueStats(
    int totalEntries,
    int unresolvedEntries,
    Instant oldestFailure,
    Instant newestFailure,
    double averageRetryCount
) {

    public static DeadLetterQueueStats empty() {
        return new DeadLetterQueueStats(0, 0, null, null, 0.0);
    }

    public boolean isEmpty() {
        return totalEntries == 0;
    }
}
