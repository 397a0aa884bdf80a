package com.ryuqq.cqrs.core.error;

/**
 * Query 핸들러 또는 미들웨어가 checked 예외로 실패함.
 *
 * <p>unchecked 예외는 감싸지 않고 그대로 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class QueryFailedException extends CqrsException {

    public QueryFailedException(String queryType, Throwable cause) {
        super("Query " + queryType + " failed: " + cause.getMessage(), cause);
    }
}
