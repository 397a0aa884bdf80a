package com.ryuqq.cqrs.application.command;

import com.ryuqq.cqrs.core.outcome.CommandResult;

/**
 * CommandBus 디스패치 결과와 중복 제거 여부.
 *
 * <p>{@code deduplicated}가 true이면 결과는 멱등성 캐시에서 왔으며,
 * 그 이벤트는 이미 발행된 것입니다.</p>
 *
 * @param result Command 결과
 * @param deduplicated 캐시 적중 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DispatchOutcome(CommandResult result, boolean deduplicated) {

    public DispatchOutcome {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }
}
