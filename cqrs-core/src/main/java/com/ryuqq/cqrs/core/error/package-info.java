/**
 * Engine error taxonomy. Every type extends the unchecked
 * {@link com.ryuqq.cqrs.core.error.CqrsException}.
 *
 * <p>Commands report these conditions through {@code CommandResult} error codes;
 * queries, saga and projection lookups throw them.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.error;
