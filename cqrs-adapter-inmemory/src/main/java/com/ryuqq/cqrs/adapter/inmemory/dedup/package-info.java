/**
 * In-memory deduplication store adapter.
 *
 * <p>{@link com.ryuqq.cqrs.adapter.inmemory.dedup.InMemoryDeduplicationStore} implements
 * {@link com.ryuqq.cqrs.core.spi.DeduplicationStore} on a {@link java.util.concurrent.ConcurrentHashMap}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.cqrs.adapter.inmemory.dedup;
