package com.ryuqq.cqrs.application.middleware;

/**
 * 요청 처리 측정값 수신자.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MetricsRecorder {

    /**
     * @param requestType Command/Query 유형
     * @param durationMs 처리 시간 (밀리초)
     * @param success 예외 없이 중단되지 않고 끝났으면 true
     */
    void record(String requestType, long durationMs, boolean success);
}
