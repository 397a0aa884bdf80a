package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.model.Identifiers;

/**
 * DomainEvent 메타데이터.
 *
 * @param correlationId 상관관계 ID
 * @param causationId 이벤트를 유발한 Command ID (null 가능)
 * @param userId 사용자 ID (null 가능)
 * @param tenantId 테넌트 ID (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventMetadata(
    String correlationId,
    String causationId,
    String userId,
    String tenantId
) {

    public EventMetadata {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
    }

    public static EventMetadata of(String correlationId) {
        return new EventMetadata(correlationId, null, null, null);
    }

    public static EventMetadata create() {
        return of(Identifiers.next("cor"));
    }

    /**
     * Command로부터 메타데이터 파생.
     *
     * <p>correlationId, userId, tenantId를 이어받고 causationId는 commandId로 설정합니다.</p>
     *
     * @param command 원인 Command
     * @return EventMetadata 인스턴스
     * @throws IllegalArgumentException command가 null인 경우
     */
    public static EventMetadata causedBy(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        CommandMetadata metadata = command.metadata();
        return new EventMetadata(metadata.correlationId(), command.commandId(), metadata.userId(), metadata.tenantId());
    }
}
