/**
 * Aggregate persistence on top of the event store: replay, optimistic
 * concurrency and snapshotting.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.application.aggregate;
