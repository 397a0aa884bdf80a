package com.ryuqq.cqrs.core.spi;

import com.ryuqq.cqrs.core.contract.Command;

import java.util.List;
import java.util.Optional;

/**
 * Bounded store of commands that exhausted their retries.
 *
 * <p><strong>Capacity:</strong> on overflow the oldest resolved entry is evicted;
 * when none is resolved the oldest entry is evicted and the loss is logged.</p>
 *
 * <p><strong>Implementation Requirements:</strong> thread-safe.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DeadLetterQueue {

    /**
     * Adds an unresolved entry.
     *
     * @param command original command
     * @param error last error message
     * @param retryCount total attempts made
     * @return the created entry
     */
    DeadLetterEntry enqueue(Command command, String error, int retryCount);

    /**
     * Unresolved entries, oldest first.
     */
    List<DeadLetterEntry> getUnresolved();

    /**
     * All entries, oldest first.
     */
    List<DeadLetterEntry> getAll();

    Optional<DeadLetterEntry> getById(String id);

    /**
     * Marks an entry resolved without removing it.
     *
     * @param id entry identifier
     * @return true if an entry was found
     */
    boolean resolve(String id);

    /**
     * Number of unresolved entries.
     */
    int size();

    DeadLetterQueueStats stats();
}
