package com.ryuqq.cqrs.core.error;

import java.time.Duration;

/**
 * Saga 단계 또는 Saga 전체의 제한 시간 초과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaTimeoutException extends CqrsException {

    private SagaTimeoutException(String message) {
        super(message);
    }

    public static SagaTimeoutException forStep(String stepName, Duration timeout) {
        return new SagaTimeoutException("Step " + stepName + " timed out after " + timeout.toMillis() + "ms");
    }

    public static SagaTimeoutException forSaga(String sagaId, Duration timeout) {
        return new SagaTimeoutException("Saga " + sagaId + " exceeded its timeout of " + timeout.toMillis() + "ms");
    }
}
