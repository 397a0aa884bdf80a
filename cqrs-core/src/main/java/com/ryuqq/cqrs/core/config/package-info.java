/**
 * Engine configuration.
 *
 * <p>{@link com.ryuqq.cqrs.core.config.CqrsEngineConfig} is an immutable record built from
 * {@code defaults()} and {@code withX(...)} copies. There is no environment variable coupling.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.core.config;
