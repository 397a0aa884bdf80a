package com.ryuqq.cqrs.core.contract;

import com.ryuqq.cqrs.core.handler.ProjectionHandler;
import com.ryuqq.cqrs.core.model.Payload;

import java.util.Set;

/**
 * Projection(읽기 모델) 정의.
 *
 * <p>{@code eventTypes}에 {@link #WILDCARD}가 포함되면 모든 이벤트에 반응합니다.</p>
 *
 * @param name Projection 이름 (고유)
 * @param eventTypes 반응할 이벤트 유형 집합
 * @param handler 순수 fold 함수 {@code (event, state) -> state}
 * @param initialState 초기 상태 (null이면 빈 Payload)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProjectionDefinition(
    String name,
    Set<String> eventTypes,
    ProjectionHandler handler,
    Payload initialState
) {

    /**
     * 모든 이벤트 유형에 매칭되는 와일드카드.
     */
    public static final String WILDCARD = "*";

    public ProjectionDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new IllegalArgumentException("eventTypes cannot be null or empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        eventTypes = Set.copyOf(eventTypes);
        if (initialState == null) {
            initialState = Payload.empty();
        }
    }

    public static ProjectionDefinition of(String name, Set<String> eventTypes, ProjectionHandler handler, Payload initialState) {
        return new ProjectionDefinition(name, eventTypes, handler, initialState);
    }

    /**
     * 이벤트 유형 매칭 여부.
     *
     * @param eventType 이벤트 유형
     * @return 반응 대상이면 true
     */
    public boolean handles(String eventType) {
        return eventTypes.contains(WILDCARD) || eventTypes.contains(eventType);
    }
}
