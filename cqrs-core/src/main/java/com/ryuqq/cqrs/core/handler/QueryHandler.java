package com.ryuqq.cqrs.core.handler;

import com.ryuqq.cqrs.core.contract.Query;

/**
 * Query 처리기.
 *
 * @param <T> 조회 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueryHandler<T> {

    /**
     * Query 처리.
     *
     * @param query 처리할 Query
     * @param context 미들웨어 컨텍스트
     * @return 조회 결과
     * @throws Exception 조회 실패 (호출자에게 전파)
     */
    T handle(Query query, MiddlewareContext context) throws Exception;
}
