/**
 * In-memory event store adapter.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.cqrs.adapter.inmemory.store.InMemoryEventStore}:
 *       Thread-safe implementation of {@link com.ryuqq.cqrs.core.spi.EventStore}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Scans are linear in the size of the log</li>
 *   <li>Suitable for Contract Tests, embedded use and as a reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.cqrs.core.spi.EventStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.cqrs.adapter.inmemory.store;
