package com.ryuqq.cqrs.core.handler;

import com.ryuqq.cqrs.core.contract.DomainEvent;

/**
 * EventStore 구독자.
 *
 * <p>예외는 EventStore가 잡아서 로그로 남기고 {@code HandlerFailure}로 돌려주며,
 * 다른 구독자 전달을 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventSubscriber {

    void onEvent(DomainEvent event) throws Exception;
}
