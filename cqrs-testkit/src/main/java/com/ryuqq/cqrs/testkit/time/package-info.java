/**
 * Deterministic time for engine tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.cqrs.testkit.time;
