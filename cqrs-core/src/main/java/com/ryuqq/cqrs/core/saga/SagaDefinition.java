package com.ryuqq.cqrs.core.saga;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Saga 정의.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * SagaDefinition definition = SagaDefinition.of("order-fulfillment", "Order Fulfillment", List.of(
 *     SagaStep.of("reserve-stock", ctx -> ..., ctx -> ...),
 *     SagaStep.of("charge-payment", ctx -> ..., ctx -> ...)
 * )).withTimeout(Duration.ofMinutes(5));
 * </pre>
 *
 * @param sagaId Saga 정의 ID (등록 키)
 * @param name 표시 이름
 * @param steps 순서 있는 단계 목록 (이름 고유)
 * @param timeout Saga 전체 제한 시간 (null이면 무제한)
 * @param onComplete 완료 콜백 (null 가능)
 * @param onFailed 실패 콜백 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SagaDefinition(
    String sagaId,
    String name,
    List<SagaStep> steps,
    Duration timeout,
    SagaCallback onComplete,
    SagaFailureCallback onFailed
) {

    public SagaDefinition {
        if (sagaId == null || sagaId.isBlank()) {
            throw new IllegalArgumentException("sagaId cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = sagaId;
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("steps cannot be null or empty");
        }
        steps = List.copyOf(steps);
        Set<String> names = new HashSet<>();
        for (SagaStep step : steps) {
            if (!names.add(step.name())) {
                throw new IllegalArgumentException("duplicate step name: " + step.name());
            }
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    public static SagaDefinition of(String sagaId, String name, List<SagaStep> steps) {
        return new SagaDefinition(sagaId, name, steps, null, null, null);
    }

    public SagaDefinition withTimeout(Duration timeout) {
        return new SagaDefinition(sagaId, name, steps, timeout, onComplete, onFailed);
    }

    public SagaDefinition withOnComplete(SagaCallback onComplete) {
        return new SagaDefinition(sagaId, name, steps, timeout, onComplete, onFailed);
    }

    public SagaDefinition withOnFailed(SagaFailureCallback onFailed) {
        return new SagaDefinition(sagaId, name, steps, timeout, onComplete, onFailed);
    }

    public Optional<SagaStep> findStep(String stepName) {
        return steps.stream().filter(step -> step.name().equals(stepName)).findFirst();
    }
}
