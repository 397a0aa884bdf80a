package com.ryuqq.cqrs.application.projection;

import com.ryuqq.cqrs.core.error.CqrsException;
import com.ryuqq.cqrs.core.outcome.HandlerFailure;

import java.util.List;

/**
 * 하나 이상의 Projection이 이벤트 적용에 실패함.
 *
 * <p>이벤트 저장소의 전역 구독자가 던지며, 발행 결과의
 * {@link HandlerFailure}로 수집됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProjectionUpdateException extends CqrsException {

    private final List<HandlerFailure> failures;

    public ProjectionUpdateException(List<HandlerFailure> failures) {
        super(describe(failures));
        this.failures = List.copyOf(failures);
    }

    public List<HandlerFailure> getFailures() {
        return failures;
    }

    private static String describe(List<HandlerFailure> failures) {
        StringBuilder message = new StringBuilder("Projection update failed:");
        for (HandlerFailure failure : failures) {
            message.append(' ').append(failure.source()).append(" (").append(failure.message()).append(')');
        }
        return message.toString();
    }
}
