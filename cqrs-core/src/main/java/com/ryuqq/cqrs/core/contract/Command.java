package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.model.Identifiers;
import com.ryuqq.cqrs.core.model.Payload;

import java.time.Instant;

/**
 * 상태 변경 명령.
 *
 * <p>Command는 특정 Aggregate에 대한 상태 변경 의도를 담으며, 생성 후 변경되지 않습니다.
 * CommandBus는 시도마다 {@link #withRetryCount(int)}로 만든 사본을 핸들러에 전달하고,
 * DLQ에는 항상 원본 Command를 보관합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Command command = Command.create(
 *     "CreateOrder",
 *     "order-1",
 *     Payload.of("total", 100),
 *     CommandMetadata.create().withIdempotencyKey("req-42")
 * );
 * </pre>
 *
 * @param commandId Command 고유 식별자
 * @param commandType Command 유형 (핸들러 라우팅 키)
 * @param aggregateId 대상 Aggregate ID
 * @param payload 업무 데이터 (null이면 빈 Payload)
 * @param metadata 메타데이터
 * @param issuedAt 발행 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Command(
    String commandId,
    String commandType,
    String aggregateId,
    Payload payload,
    CommandMetadata metadata,
    Instant issuedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public Command {
        if (commandId == null || commandId.isBlank()) {
            throw new IllegalArgumentException("commandId cannot be null or blank");
        }
        if (commandType == null || commandType.isBlank()) {
            throw new IllegalArgumentException("commandType cannot be null or blank");
        }
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId cannot be null or blank");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (issuedAt == null) {
            throw new IllegalArgumentException("issuedAt cannot be null");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * 새 commandId와 현재 시각으로 Command 생성.
     *
     * @param commandType Command 유형
     * @param aggregateId 대상 Aggregate ID
     * @param payload 업무 데이터
     * @param metadata 메타데이터
     * @return Command 인스턴스
     */
    public static Command create(String commandType, String aggregateId, Payload payload, CommandMetadata metadata) {
        return new Command(Identifiers.next("cmd"), commandType, aggregateId, payload, metadata, Instant.now());
    }

    /**
     * 새 correlationId를 가진 기본 메타데이터로 Command 생성.
     *
     * @param commandType Command 유형
     * @param aggregateId 대상 Aggregate ID
     * @param payload 업무 데이터
     * @return Command 인스턴스
     */
    public static Command create(String commandType, String aggregateId, Payload payload) {
        return create(commandType, aggregateId, payload, CommandMetadata.create());
    }

    /**
     * 시도 번호만 바꾼 사본.
     *
     * @param retryCount 시도 번호 (0부터)
     * @return Command 사본
     */
    public Command withRetryCount(int retryCount) {
        return new Command(commandId, commandType, aggregateId, payload, metadata.withRetryCount(retryCount), issuedAt);
    }
}
