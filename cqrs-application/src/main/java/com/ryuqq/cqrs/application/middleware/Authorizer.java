package com.ryuqq.cqrs.application.middleware;

import com.ryuqq.cqrs.core.handler.MiddlewareContext;

/**
 * 요청 권한 판정기.
 *
 * <p>권한 정책은 엔진 밖에서 제공됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Authorizer {

    /**
     * @param context 요청 컨텍스트 (userId, tenantId, 요청 유형 포함)
     * @return 허용이면 true
     */
    boolean isAllowed(MiddlewareContext context);
}
