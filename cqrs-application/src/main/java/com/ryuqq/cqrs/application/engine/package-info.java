/**
 * Engine facade wiring the repository, buses, projections and sagas over
 * the configured ports.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.application.engine;
