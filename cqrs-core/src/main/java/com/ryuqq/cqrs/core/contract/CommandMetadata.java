package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.model.IdempotencyKey;
import com.ryuqq.cqrs.core.model.Identifiers;
import com.ryuqq.cqrs.core.model.Priority;

/**
 * Command 메타데이터.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>correlationId:</strong> 요청 흐름 추적 ID (필수)</li>
 *   <li><strong>causationId:</strong> 이 Command를 유발한 메시지 ID (null 가능)</li>
 *   <li><strong>userId / tenantId:</strong> 요청 주체 (null 가능)</li>
 *   <li><strong>idempotencyKey:</strong> 중복 제거 키 (null 가능)</li>
 *   <li><strong>retryCount:</strong> 현재 시도 번호 (0부터 시작, CommandBus가 시도마다 설정)</li>
 *   <li><strong>maxRetries:</strong> Command별 재시도 한도 (null이면 엔진 기본값)</li>
 *   <li><strong>priority:</strong> 우선순위 (기본 NORMAL)</li>
 * </ul>
 *
 * @param correlationId 상관관계 ID
 * @param causationId 원인 메시지 ID (null 가능)
 * @param userId 사용자 ID (null 가능)
 * @param tenantId 테넌트 ID (null 가능)
 * @param idempotencyKey 멱등성 키 (null 가능)
 * @param retryCount 시도 번호 (0 이상)
 * @param maxRetries 재시도 한도 (null 가능, 0 이상)
 * @param priority 우선순위 (null이면 NORMAL)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CommandMetadata(
    String correlationId,
    String causationId,
    String userId,
    String tenantId,
    IdempotencyKey idempotencyKey,
    int retryCount,
    Integer maxRetries,
    Priority priority
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException correlationId가 비어있거나 카운터가 음수인 경우
     */
    public CommandMetadata {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (priority == null) {
            priority = Priority.NORMAL;
        }
    }

    /**
     * correlationId만 지정한 메타데이터.
     *
     * @param correlationId 상관관계 ID
     * @return CommandMetadata 인스턴스
     */
    public static CommandMetadata of(String correlationId) {
        return new CommandMetadata(correlationId, null, null, null, null, 0, null, Priority.NORMAL);
    }

    /**
     * 새 correlationId로 메타데이터 생성.
     *
     * @return CommandMetadata 인스턴스
     */
    public static CommandMetadata create() {
        return of(Identifiers.next("cor"));
    }

    public CommandMetadata withCausationId(String causationId) {
        return new CommandMetadata(correlationId, causationId, userId, tenantId, idempotencyKey, retryCount, maxRetries, priority);
    }

    public CommandMetadata withUserId(String userId) {
        return new CommandMetadata(correlationId, causationId, userId, tenantId, idempotencyKey, retryCount, maxRetries, priority);
    }

    public CommandMetadata withTenantId(String tenantId) {
        return new CommandMetadata(correlationId, causationId, userId, tenantId, idempotencyKey, retryCount, maxRetries, priority);
    }

    public CommandMetadata withIdempotencyKey(IdempotencyKey idempotencyKey) {
        return new CommandMetadata(correlationId, causationId, userId, tenantId, idempotencyKey, retryCount, maxRetries, priority);
    }

    public CommandMetadata withIdempotencyKey(String idempotencyKey) {
        return withIdempotencyKey(IdempotencyKey.of(idempotencyKey));
    }

    public CommandMetadata withRetryCount(int retryCount) {
        return new CommandMetadata(correlationId, causationId, userId, tenantId, idempotencyKey, retryCount, maxRetries, priority);
    }

    public CommandMetadata withMaxRetries(Integer maxRetries) {
        return new CommandMetadata(correlationId, causationId, userId, tenantId, idempotencyKey, retryCount, maxRetries, priority);
    }

    public CommandMetadata withPriority(Priority priority) {
        return new CommandMetadata(correlationId, causationId, userId, tenantId, idempotencyKey, retryCount, maxRetries, priority);
    }
}
