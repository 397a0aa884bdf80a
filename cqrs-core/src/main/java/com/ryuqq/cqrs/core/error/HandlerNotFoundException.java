package com.ryuqq.cqrs.core.error;

/**
 * 요청 유형에 등록된 핸들러가 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class HandlerNotFoundException extends CqrsException {

    private final String requestType;

    public HandlerNotFoundException(String kind, String requestType) {
        super("No handler registered for " + kind + " type: " + requestType);
        this.requestType = requestType;
    }

    public String getRequestType() {
        return requestType;
    }
}
