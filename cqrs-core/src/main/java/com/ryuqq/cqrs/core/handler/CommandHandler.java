package com.ryuqq.cqrs.core.handler;

import com.ryuqq.cqrs.core.contract.Command;
import com.ryuqq.cqrs.core.outcome.CommandResult;

/**
 * Command 처리기.
 *
 * <p>CommandBus는 예외가 발생하면 백오프 후 재시도하므로, 구현체는 재시도에 안전해야 합니다
 * (또는 멱등성 키로 보호되어야 합니다). 실패 결과를 직접 반환하면 재시도 없이 그대로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * Command 처리.
     *
     * @param command 처리할 Command (시도 번호가 설정된 사본)
     * @param context 현재 시도의 미들웨어 컨텍스트
     * @return 처리 결과
     * @throws Exception 일시적 실패 (재시도 대상)
     */
    CommandResult handle(Command command, MiddlewareContext context) throws Exception;
}
