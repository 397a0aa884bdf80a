package com.ryuqq.cqrs.application.projection;

import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.contract.ProjectionDefinition;
import com.ryuqq.cqrs.core.error.ProjectionNotFoundException;
import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.outcome.HandlerFailure;
import com.ryuqq.cqrs.core.spi.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이벤트를 읽기 모델로 접는 Projection 관리자.
 *
 * <p><strong>상태 갱신 규칙:</strong></p>
 * <ul>
 *   <li>{@link #apply(DomainEvent)}: 이벤트 유형에 반응하는 모든 Projection에 대해
 *       {@code state = handler(event, state)}, 위치(position) 1 증가</li>
 *   <li>핸들러 예외는 해당 Projection만 건너뛰고 {@link HandlerFailure}로 반환</li>
 *   <li>{@link #rebuild(String, EventStore)}: 초기 상태에서 전체 이벤트 로그를
 *       저장 순서대로 다시 접음. 재구성 중 예외가 나면 기존 상태를 유지하고 예외를 전파</li>
 * </ul>
 *
 * <p>apply와 rebuild는 서로 직렬화되므로, 재구성 중 도착한 이벤트가
 * 재구성 결과에 덮어써지지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProjectionManager {

    private static final Logger log = LoggerFactory.getLogger(ProjectionManager.class);

    private final Map<String, Projection> projections = new ConcurrentHashMap<>();

    /**
     * Projection 등록 (같은 이름은 초기 상태로 교체).
     */
    public synchronized void register(ProjectionDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (projections.put(definition.name(), new Projection(definition)) != null) {
            log.warn("Replaced projection {} and reset its state", definition.name());
        } else {
            log.info("Registered projection {} for {}", definition.name(), definition.eventTypes());
        }
    }

    /**
     * 이벤트 적용.
     *
     * @param event 발행된 이벤트
     * @return 실패한 Projection 목록 (모두 성공하면 빈 목록)
     */
    public synchronized List<HandlerFailure> apply(DomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }

        List<HandlerFailure> failures = new ArrayList<>();
        for (Projection projection : projections.values()) {
            if (!projection.definition.handles(event.eventType())) {
                continue;
            }
            try {
                projection.state = fold(projection.definition, event, projection.state);
                projection.position++;
            } catch (RuntimeException e) {
                log.error("Projection {} failed on event {} ({})",
                    projection.definition.name(), event.eventId(), event.eventType(), e);
                failures.add(new HandlerFailure(
                    "projection:" + projection.definition.name(), event.eventId(), event.eventType(), e
                ));
            }
        }
        return failures;
    }

    /**
     * 전체 이벤트 로그로부터 재구성.
     *
     * @param name Projection 이름
     * @param eventStore 이벤트 저장소
     * @throws ProjectionNotFoundException 등록되지 않은 이름인 경우
     */
    public synchronized void rebuild(String name, EventStore eventStore) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        Projection projection = require(name);
        ProjectionDefinition definition = projection.definition;

        Payload state = definition.initialState();
        long position = 0;
        for (DomainEvent event : eventStore.getAllEvents(0)) {
            if (definition.handles(event.eventType())) {
                state = fold(definition, event, state);
                position++;
            }
        }

        projection.state = state;
        projection.position = position;
        log.info("Rebuilt projection {} from {} event(s)", name, position);
    }

    public synchronized Payload getState(String name) {
        return require(name).state;
    }

    public synchronized long getPosition(String name) {
        return require(name).position;
    }

    public List<String> listProjections() {
        return List.copyOf(projections.keySet());
    }

    private Projection require(String name) {
        Projection projection = projections.get(name);
        if (projection == null) {
            throw new ProjectionNotFoundException(name);
        }
        return projection;
    }

    private static Payload fold(ProjectionDefinition definition, DomainEvent event, Payload state) {
        Payload next = definition.handler().apply(event, state);
        return next != null ? next : Payload.empty();
    }

    private static final class Projection {

        private final ProjectionDefinition definition;
        private Payload state;
        private long position;

        private Projection(ProjectionDefinition definition) {
            this.definition = definition;
            this.state = definition.initialState();
        }
    }
}
