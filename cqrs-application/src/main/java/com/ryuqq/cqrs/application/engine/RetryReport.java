package com.ryuqq.cqrs.application.engine;

/**
 * DLQ 재처리 결과.
 *
 * @param retried 재처리 시도한 항목 수
 * @param succeeded 성공하여 해결(resolve)된 항목 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetryReport(int retried, int succeeded) {

    public RetryReport {
        if (retried < 0) {
            throw new IllegalArgumentException("retried must be non-negative (current: " + retried + ")");
        }
        if (succeeded < 0 || succeeded > retried) {
            throw new IllegalArgumentException(
                "succeeded must be between 0 and retried (current: " + succeeded + ", retried: " + retried + ")"
            );
        }
    }

    public int failed() {
        return retried - succeeded;
    }
}
