/**
 * Service Provider Interfaces for the engine's storage ports.
 *
 * <h2>Ports</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cqrs.core.spi.EventStore} - event log, snapshots and subscriber delivery</li>
 *   <li>{@link com.ryuqq.cqrs.core.spi.DeadLetterQueue} - bounded store for commands that exhausted retries</li>
 *   <li>{@link com.ryuqq.cqrs.core.spi.DeduplicationStore} - idempotency cache for command results</li>
 * </ul>
 *
 * <p>Adapters implement these interfaces; the application layer depends only on them.
 * The {@code cqrs-testkit} module ships contract tests every implementation must pass.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.spi;
