/**
 * Results returned by the engine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.cqrs.core.outcome.CommandResult} - success or classified failure of a command</li>
 *   <li>{@link com.ryuqq.cqrs.core.outcome.QueryResult} - query data plus cache metadata</li>
 *   <li>{@link com.ryuqq.cqrs.core.outcome.HandlerFailure} - a subscriber or projection failure surfaced by publication</li>
 * </ul>
 *
 * <p>Commands report failure through results; they do not throw.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.outcome;
