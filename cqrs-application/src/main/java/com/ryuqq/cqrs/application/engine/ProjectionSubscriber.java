package com.ryuqq.cqrs.application.engine;

import com.ryuqq.cqrs.application.projection.ProjectionManager;
import com.ryuqq.cqrs.application.projection.ProjectionUpdateException;
import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.handler.EventSubscriber;
import com.ryuqq.cqrs.core.outcome.HandlerFailure;

import java.util.List;

/**
 * 발행된 이벤트를 ProjectionManager로 전달하는 전역 구독자.
 *
 * <p>Projection 실패가 있으면 {@link ProjectionUpdateException}을 던져
 * 발행 결과에 실패로 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ProjectionSubscriber implements EventSubscriber {

    private final ProjectionManager projectionManager;

    ProjectionSubscriber(ProjectionManager projectionManager) {
        this.projectionManager = projectionManager;
    }

    @Override
    public void onEvent(DomainEvent event) {
        List<HandlerFailure> failures = projectionManager.apply(event);
        if (!failures.isEmpty()) {
            throw new ProjectionUpdateException(failures);
        }
    }
}
