package com.ryuqq.cqrs.core.statemachine;

/**
 * Saga 인스턴스의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * RUNNING
 *    │
 *    ├─► COMPLETED (모든 단계 성공)
 *    │
 *    └─► COMPENSATING (단계 실패)
 *            │
 *            └─► FAILED (보상 완료)
 *
 * 금지된 전이:
 * - RUNNING → FAILED ❌ (보상 단계를 건너뛸 수 없음)
 * - COMPENSATING → COMPLETED ❌
 * - 종료 상태에서의 모든 전이 ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SagaStatus {

    /**
     * 단계 실행 중.
     */
    RUNNING,

    /**
     * 완료된 단계를 역순으로 보상 중.
     */
    COMPENSATING,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패 (보상 종료).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 활성 상태인지 확인.
     *
     * @return RUNNING 또는 COMPENSATING인 경우 true
     */
    public boolean isActive() {
        return !isTerminal();
    }
}
