package com.ryuqq.cqrs.core.saga;

/**
 * Saga 단계의 실행 또는 보상 동작.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SagaAction {

    void run(SagaContext context) throws Exception;
}
