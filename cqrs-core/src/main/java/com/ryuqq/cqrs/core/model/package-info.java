/**
 * Value objects shared by commands, queries, events and read models.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cqrs.core.model.Payload} - Deeply immutable, string-keyed business data</li>
 *   <li>{@link com.ryuqq.cqrs.core.model.PayloadSchema} - Declared fields and value types, checked at the handler boundary</li>
 *   <li>{@link com.ryuqq.cqrs.core.model.IdempotencyKey} - Client-supplied deduplication token</li>
 *   <li>{@link com.ryuqq.cqrs.core.model.Priority} / {@link com.ryuqq.cqrs.core.model.Consistency} - Request hints</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Nested maps and lists are copied and frozen on construction</li>
 *   <li><strong>Fail fast:</strong> Invalid values are rejected with {@link java.lang.IllegalArgumentException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.model;
