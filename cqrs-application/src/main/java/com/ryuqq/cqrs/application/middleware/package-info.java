/**
 * Middleware chain and built-in middlewares.
 *
 * <p>A middleware either calls {@code next.proceed()} at most once or aborts
 * the context. Abort reasons surface as {@code MIDDLEWARE_ABORTED} command
 * results or {@code MiddlewareAbortedException} for queries.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.application.middleware;
