package com.ryuqq.cqrs.core.saga;

import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.statemachine.SagaStatus;
import com.ryuqq.cqrs.core.statemachine.SagaTransition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 실행 중인 Saga 인스턴스의 상태.
 *
 * <p>단계들은 {@link #put(String, Object)}/{@link #get(String)}으로 데이터를 주고받습니다.
 * 상태 변경 메서드({@code transitionTo}, {@code markStepCompleted} 등)는 SagaManager 전용입니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 타임아웃이 있는 단계는 작업 스레드에서 실행되므로
 * 모든 접근은 동기화됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SagaContext {

    private final String sagaId;
    private final String instanceId;
    private final Instant startedAt;
    private final Map<String, Object> data;
    private final List<String> completedSteps = new ArrayList<>();
    private String currentStep;
    private SagaStatus status = SagaStatus.RUNNING;
    private String error;
    private Instant finishedAt;

    public SagaContext(String sagaId, String instanceId, Payload initialData, Instant startedAt) {
        if (sagaId == null || sagaId.isBlank()) {
            throw new IllegalArgumentException("sagaId cannot be null or blank");
        }
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId cannot be null or blank");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        this.sagaId = sagaId;
        this.instanceId = instanceId;
        this.startedAt = startedAt;
        this.data = new LinkedHashMap<>(initialData == null ? Map.of() : initialData.asMap());
    }

    public String getSagaId() {
        return sagaId;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Object get(String key) {
        return data.get(key);
    }

    public synchronized void put(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        data.put(key, value);
    }

    /**
     * 현재 데이터의 불변 사본.
     */
    public synchronized Payload getData() {
        return Payload.of(data);
    }

    /**
     * 완료된 단계 이름 (완료 순서).
     */
    public synchronized List<String> getCompletedSteps() {
        return Collections.unmodifiableList(new ArrayList<>(completedSteps));
    }

    public synchronized String getCurrentStep() {
        return currentStep;
    }

    public synchronized SagaStatus getStatus() {
        return status;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized void transitionTo(SagaStatus next) {
        this.status = SagaTransition.transition(status, next);
    }

    public synchronized void setCurrentStep(String stepName) {
        this.currentStep = stepName;
    }

    public synchronized void markStepCompleted(String stepName) {
        completedSteps.add(stepName);
    }

    public synchronized void setError(String error) {
        this.error = error;
    }

    public synchronized void finish(Instant finishedAt) {
        this.currentStep = null;
        this.finishedAt = finishedAt;
    }

    @Override
    public synchronized String toString() {
        return "SagaContext{" +
            "sagaId='" + sagaId + '\'' +
            ", instanceId='" + instanceId + '\'' +
            ", status=" + status +
            ", completedSteps=" + completedSteps +
            ", currentStep=" + currentStep +
            '}';
    }
}
