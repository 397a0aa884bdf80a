package com.ryuqq.cqrs.core.error;

/**
 * 엔진 자체 오류의 최상위 예외.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CqrsException extends RuntimeException {

    public CqrsException(String message) {
        super(message);
    }

    public CqrsException(String message, Throwable cause) {
        super(message, cause);
    }
}
