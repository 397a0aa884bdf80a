/**
 * Query dispatch with a TTL result cache keyed by canonical parameter JSON.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.cqrs.application.query;
