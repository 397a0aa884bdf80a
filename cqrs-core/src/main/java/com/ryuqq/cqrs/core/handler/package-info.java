/**
 * Caller-supplied behaviour plugged into the engine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.cqrs.core.handler.CommandHandler} / {@link com.ryuqq.cqrs.core.handler.QueryHandler} - request handlers</li>
 *   <li>{@link com.ryuqq.cqrs.core.handler.Middleware} - pipeline stage with its per-request {@link com.ryuqq.cqrs.core.handler.MiddlewareContext}</li>
 *   <li>{@link com.ryuqq.cqrs.core.handler.EventApplier} / {@link com.ryuqq.cqrs.core.handler.ProjectionHandler} - pure folds</li>
 *   <li>{@link com.ryuqq.cqrs.core.handler.EventSubscriber} - event store subscriber</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.handler;
