package com.ryuqq.cqrs.core.error;

/**
 * 등록되지 않은 Saga 정의.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaNotFoundException extends CqrsException {

    public SagaNotFoundException(String sagaId) {
        super("Saga not found: " + sagaId);
    }
}
