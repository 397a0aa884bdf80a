/**
 * In-memory dead letter queue adapter.
 *
 * <p>{@link com.ryuqq.cqrs.adapter.inmemory.dlq.InMemoryDeadLetterQueue} implements
 * {@link com.ryuqq.cqrs.core.spi.DeadLetterQueue} with a bounded, insertion-ordered list.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.cqrs.adapter.inmemory.dlq;
