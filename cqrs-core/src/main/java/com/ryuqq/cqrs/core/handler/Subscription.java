package com.ryuqq.cqrs.core.handler;

/**
 * 구독 해제 핸들.
 *
 * <p>{@link #unsubscribe()}는 해당 등록 하나만 제거하며, 여러 번 호출해도 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
