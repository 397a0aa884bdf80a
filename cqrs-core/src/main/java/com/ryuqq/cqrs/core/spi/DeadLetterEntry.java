package com.ryuqq.cqrs.core.spi;

import com.ryuqq.cqrs.core.contract.Command;

import java.time.Instant;

/**
 * A command that exhausted its retries.
 *
 * @param id entry identifier
 * @param command the original command as dispatched
 * @param error last error message
 * @param failedAt time the entry was created
 * @param retryCount total attempts made
 * @param resolved whether an operator or a successful replay resolved it
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DeadLetterEntry(
    String id,
    Command command,
    String error,
    Instant failedAt,
    int retryCount,
    boolean resolved
) {

    public DeadLetterEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (failedAt == null) {
            throw new IllegalArgumentException("failedAt cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
    }

    public DeadLetterEntry markResolved() {
        return resolved ? this : new DeadLetterEntry(id, command, error, failedAt, retryCount, true);
    }
}
