package com.ryuqq.cqrs.core.outcome;

/**
 * 실패한 Command 결과의 분류 코드.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /** 등록된 핸들러 없음 (재시도/DLQ 없음) */
    HANDLER_NOT_FOUND,

    /** 미들웨어가 처리를 중단함 (재시도 없음) */
    MIDDLEWARE_ABORTED,

    /** 낙관적 동시성 충돌 (호출자가 다시 시도 가능) */
    CONCURRENCY_CONFLICT,

    /** 재시도 한도 소진, DLQ로 이동됨 */
    RETRIES_EXHAUSTED
}
