package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.model.Identifiers;
import com.ryuqq.cqrs.core.model.Payload;

import java.time.Instant;

/**
 * Aggregate에 일어난 불변의 사실.
 *
 * <p>모든 필드가 불변 타입이므로({@link Payload}는 깊은 불변 사본), EventStore에
 * 저장된 이벤트는 이후 변경될 수 없습니다.</p>
 *
 * <p><strong>버전 규칙:</strong></p>
 * <ul>
 *   <li>Aggregate별로 1부터 시작</li>
 *   <li>빈틈 없이 1씩 증가 (AggregateRepository가 저장 시 검증)</li>
 * </ul>
 *
 * @param eventId 이벤트 고유 식별자
 * @param aggregateId Aggregate ID
 * @param aggregateType Aggregate 유형
 * @param eventType 이벤트 유형
 * @param version Aggregate 내 버전 (1 이상)
 * @param payload 이벤트 데이터 (null이면 빈 Payload)
 * @param metadata 메타데이터
 * @param occurredAt 발생 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DomainEvent(
    String eventId,
    String aggregateId,
    String aggregateType,
    String eventType,
    long version,
    Payload payload,
    EventMetadata metadata,
    Instant occurredAt
) {

    public DomainEvent {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId cannot be null or blank");
        }
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType cannot be null or blank");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * 새 eventId와 현재 시각으로 이벤트 생성.
     *
     * @param aggregateId Aggregate ID
     * @param aggregateType Aggregate 유형
     * @param eventType 이벤트 유형
     * @param version 버전
     * @param payload 이벤트 데이터
     * @param metadata 메타데이터
     * @return DomainEvent 인스턴스
     */
    public static DomainEvent create(
        String aggregateId,
        String aggregateType,
        String eventType,
        long version,
        Payload payload,
        EventMetadata metadata
    ) {
        return new DomainEvent(
            Identifiers.next("evt"), aggregateId, aggregateType, eventType, version, payload, metadata, Instant.now()
        );
    }

    /**
     * 새 correlationId를 가진 메타데이터로 이벤트 생성.
     */
    public static DomainEvent create(String aggregateId, String aggregateType, String eventType, long version, Payload payload) {
        return create(aggregateId, aggregateType, eventType, version, payload, EventMetadata.create());
    }
}
