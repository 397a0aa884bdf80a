package com.ryuqq.cqrs.core.outcome;

import java.time.Instant;

/**
 * Query 처리 결과.
 *
 * <p>캐시 적중 시 {@code fromCache}는 true, {@code executionMs}는 0,
 * {@code staleAt}은 캐시 항목의 만료 시각입니다.</p>
 *
 * @param queryId 대상 Query ID
 * @param data 조회 결과 (null 가능)
 * @param executionMs 핸들러 실행 시간 (밀리초)
 * @param fromCache 캐시 적중 여부
 * @param staleAt 캐시 만료 시각 (캐시 미사용 시 null)
 * @param <T> 결과 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueryResult<T>(
    String queryId,
    T data,
    long executionMs,
    boolean fromCache,
    Instant staleAt
) {

    public QueryResult {
        if (queryId == null || queryId.isBlank()) {
            throw new IllegalArgumentException("queryId cannot be null or blank");
        }
        if (executionMs < 0) {
            throw new IllegalArgumentException("executionMs must be non-negative (current: " + executionMs + ")");
        }
    }

    public static <T> QueryResult<T> executed(String queryId, T data, long executionMs, Instant staleAt) {
        return new QueryResult<>(queryId, data, executionMs, false, staleAt);
    }

    public static <T> QueryResult<T> cached(String queryId, T data, Instant staleAt) {
        return new QueryResult<>(queryId, data, 0L, true, staleAt);
    }

    /**
     * 결과 데이터를 지정 타입으로 변환한 사본 반환.
     *
     * @param type 기대하는 결과 타입
     * @param <R> 결과 타입
     * @return 같은 메타데이터를 가진 QueryResult
     * @throws ClassCastException data가 해당 타입이 아닌 경우
     */
    public <R> QueryResult<R> as(Class<R> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new QueryResult<>(queryId, type.cast(data), executionMs, fromCache, staleAt);
    }
}
