/**
 * Saga execution: ordered steps with retry and timeout, reverse-order
 * compensation and bounded retention of finished instances.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.application.saga;
