package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.model.Consistency;
import com.ryuqq.cqrs.core.model.Identifiers;

/**
 * Query 메타데이터.
 *
 * @param correlationId 상관관계 ID
 * @param userId 사용자 ID (null 가능)
 * @param tenantId 테넌트 ID (null 가능)
 * @param cacheTtlMs 캐시 TTL 재정의 (밀리초, null이면 엔진 기본값)
 * @param consistency 일관성 요구 수준 (null이면 EVENTUAL)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueryMetadata(
    String correlationId,
    String userId,
    String tenantId,
    Long cacheTtlMs,
    Consistency consistency
) {

    public QueryMetadata {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        if (cacheTtlMs != null && cacheTtlMs <= 0) {
            throw new IllegalArgumentException("cacheTtlMs must be positive (current: " + cacheTtlMs + ")");
        }
        if (consistency == null) {
            consistency = Consistency.EVENTUAL;
        }
    }

    public static QueryMetadata of(String correlationId) {
        return new QueryMetadata(correlationId, null, null, null, Consistency.EVENTUAL);
    }

    public static QueryMetadata create() {
        return of(Identifiers.next("cor"));
    }

    public QueryMetadata withUserId(String userId) {
        return new QueryMetadata(correlationId, userId, tenantId, cacheTtlMs, consistency);
    }

    public QueryMetadata withTenantId(String tenantId) {
        return new QueryMetadata(correlationId, userId, tenantId, cacheTtlMs, consistency);
    }

    public QueryMetadata withCacheTtlMs(Long cacheTtlMs) {
        return new QueryMetadata(correlationId, userId, tenantId, cacheTtlMs, consistency);
    }

    public QueryMetadata withConsistency(Consistency consistency) {
        return new QueryMetadata(correlationId, userId, tenantId, cacheTtlMs, consistency);
    }
}
