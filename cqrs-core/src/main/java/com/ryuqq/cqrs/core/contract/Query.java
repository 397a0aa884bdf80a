package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.model.Identifiers;
import com.ryuqq.cqrs.core.model.Payload;

/**
 * 상태 조회 요청.
 *
 * @param queryId Query 고유 식별자
 * @param queryType Query 유형 (핸들러 라우팅 키)
 * @param params 조회 파라미터 (null이면 빈 Payload)
 * @param metadata 메타데이터
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Query(
    String queryId,
    String queryType,
    Payload params,
    QueryMetadata metadata
) {

    public Query {
        if (queryId == null || queryId.isBlank()) {
            throw new IllegalArgumentException("queryId cannot be null or blank");
        }
        if (queryType == null || queryType.isBlank()) {
            throw new IllegalArgumentException("queryType cannot be null or blank");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (params == null) {
            params = Payload.empty();
        }
    }

    public static Query create(String queryType, Payload params, QueryMetadata metadata) {
        return new Query(Identifiers.next("qry"), queryType, params, metadata);
    }

    public static Query create(String queryType, Payload params) {
        return create(queryType, params, QueryMetadata.create());
    }
}
