package com.ryuqq.cqrs.core.handler;

/**
 * Command/Query 처리 파이프라인의 미들웨어.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>체인을 이어가려면 {@link Next#proceed()}를 정확히 한 번 호출</li>
 *   <li>중단하려면 {@link MiddlewareContext#abort(String)} 호출 후 proceed 없이 반환</li>
 *   <li>proceed를 두 번 호출하면 {@link IllegalStateException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Middleware {

    /**
     * 미들웨어 처리.
     *
     * @param context 요청 컨텍스트
     * @param next 다음 단계
     * @throws Exception 처리 중 오류 (Command는 재시도 대상, Query는 호출자에게 전파)
     */
    void handle(MiddlewareContext context, Next next) throws Exception;

    /**
     * 체인의 다음 단계.
     */
    @FunctionalInterface
    interface Next {

        void proceed() throws Exception;
    }
}
