package com.ryuqq.cqrs.core.error;

/**
 * 미들웨어가 Query 처리를 중단함.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MiddlewareAbortedException extends CqrsException {

    private final String reason;

    public MiddlewareAbortedException(String reason) {
        super("Middleware aborted: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
