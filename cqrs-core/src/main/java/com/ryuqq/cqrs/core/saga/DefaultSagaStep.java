package com.ryuqq.cqrs.core.saga;

import java.time.Duration;

/**
 * {@link SagaStep.Builder}가 생성하는 기본 구현.
 */
record DefaultSagaStep(
    String name,
    SagaAction executeAction,
    SagaAction compensateAction,
    int retries,
    Duration timeout
) implements SagaStep {

    DefaultSagaStep {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (executeAction == null) {
            throw new IllegalArgumentException("execute cannot be null");
        }
        if (compensateAction == null) {
            throw new IllegalArgumentException("compensate cannot be null");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative (current: " + retries + ")");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    @Override
    public void execute(SagaContext context) throws Exception {
        executeAction.run(context);
    }

    @Override
    public void compensate(SagaContext context) throws Exception {
        compensateAction.run(context);
    }
}
