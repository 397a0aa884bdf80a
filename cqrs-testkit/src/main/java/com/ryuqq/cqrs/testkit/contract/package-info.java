/**
 * SPI contract tests.
 *
 * <p>Abstract JUnit 5 classes that any adapter extends to prove it honours the
 * {@link com.ryuqq.cqrs.core.spi.EventStore}, {@link com.ryuqq.cqrs.core.spi.DeadLetterQueue}
 * and {@link com.ryuqq.cqrs.core.spi.DeduplicationStore} contracts.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.cqrs.testkit.contract;
