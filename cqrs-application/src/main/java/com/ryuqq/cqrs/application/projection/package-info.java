/**
 * Read-model projections folded from published events, with full rebuild
 * from the event log.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.application.projection;
