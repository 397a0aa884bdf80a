package com.ryuqq.cqrs.core.saga;

/**
 * Saga 실패 콜백 (보상 완료 후 호출).
 *
 * <p>예외는 로그로만 남고 Saga 상태를 바꾸지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SagaFailureCallback {

    void onFailed(SagaContext context, Throwable error) throws Exception;
}
