package com.ryuqq.cqrs.application.aggregate;

import com.ryuqq.cqrs.core.model.Payload;

/**
 * 재생으로 복원된 Aggregate 상태와 버전.
 *
 * @param state 상태 (이벤트가 없으면 빈 Payload)
 * @param version 마지막으로 반영된 이벤트 버전 (이벤트가 없으면 0)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AggregateState(Payload state, long version) {

    public AggregateState {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
    }

    public static AggregateState empty() {
        return new AggregateState(Payload.empty(), 0L);
    }

    /**
     * 다음 이벤트가 가져야 할 버전.
     */
    public long nextVersion() {
        return version + 1;
    }
}
