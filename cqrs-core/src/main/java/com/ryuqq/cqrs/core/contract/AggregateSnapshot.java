package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.model.Payload;

import java.time.Instant;

/**
 * Aggregate 상태 스냅샷.
 *
 * <p>재생 비용을 줄이기 위한 성능 최적화일 뿐이며, 진실의 원천은 항상 이벤트 로그입니다.
 * {@code version}은 스냅샷에 반영된 마지막 이벤트의 버전과 같아야 합니다.</p>
 *
 * @param aggregateId Aggregate ID
 * @param aggregateType Aggregate 유형
 * @param version 마지막으로 반영된 이벤트 버전
 * @param state 상태
 * @param takenAt 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AggregateSnapshot(
    String aggregateId,
    String aggregateType,
    long version,
    Payload state,
    Instant takenAt
) {

    public AggregateSnapshot {
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId cannot be null or blank");
        }
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType cannot be null or blank");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
        if (takenAt == null) {
            throw new IllegalArgumentException("takenAt cannot be null");
        }
        if (state == null) {
            state = Payload.empty();
        }
    }
}
