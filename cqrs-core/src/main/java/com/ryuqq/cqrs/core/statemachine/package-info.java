/**
 * Saga lifecycle state machine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.cqrs.core.statemachine.SagaStatus} - RUNNING, COMPENSATING, COMPLETED, FAILED</li>
 *   <li>{@link com.ryuqq.cqrs.core.statemachine.SagaTransition} - rejects illegal moves</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.statemachine;
