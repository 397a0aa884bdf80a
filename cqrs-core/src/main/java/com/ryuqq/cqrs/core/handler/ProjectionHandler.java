package com.ryuqq.cqrs.core.handler;

import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.model.Payload;

/**
 * Projection 순수 fold 함수 {@code (event, state) -> state}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProjectionHandler {

    Payload apply(DomainEvent event, Payload state);
}
