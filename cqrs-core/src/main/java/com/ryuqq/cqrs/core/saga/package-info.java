/**
 * Saga model: definitions, steps and the per-instance context.
 *
 * <p>Execution lives in {@code com.ryuqq.cqrs.application.saga.SagaManager}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.saga;
