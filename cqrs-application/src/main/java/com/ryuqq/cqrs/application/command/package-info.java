/**
 * Command dispatch: middleware pipeline, retry with backoff, idempotency
 * deduplication and dead-letter routing.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.application.command;
