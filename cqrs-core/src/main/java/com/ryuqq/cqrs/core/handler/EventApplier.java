package com.ryuqq.cqrs.core.handler;

import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.model.Payload;

/**
 * Aggregate 재생에 사용되는 순수 fold 함수 {@code (state, event) -> state}.
 *
 * <p>재생 전용이며 부수 효과가 없어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventApplier {

    Payload apply(Payload state, DomainEvent event);
}
