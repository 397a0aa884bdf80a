/**
 * Message contracts exchanged with the engine.
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cqrs.core.contract.Command} - State-changing request addressed to one aggregate</li>
 *   <li>{@link com.ryuqq.cqrs.core.contract.Query} - State-reading request</li>
 *   <li>{@link com.ryuqq.cqrs.core.contract.DomainEvent} - Immutable fact, the unit of persistence</li>
 *   <li>{@link com.ryuqq.cqrs.core.contract.AggregateSnapshot} - Replay shortcut, never authoritative</li>
 *   <li>{@link com.ryuqq.cqrs.core.contract.ProjectionDefinition} - Read model fold over the event log</li>
 * </ul>
 *
 * <p>All contracts are records validated in their compact constructors.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.contract;
