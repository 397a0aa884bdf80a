package com.ryuqq.cqrs.core.saga;

/**
 * Saga 완료 콜백.
 *
 * <p>예외는 로그로만 남고 Saga 상태를 바꾸지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SagaCallback {

    void onComplete(SagaContext context) throws Exception;
}
