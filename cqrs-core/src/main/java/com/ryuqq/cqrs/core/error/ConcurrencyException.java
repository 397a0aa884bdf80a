package com.ryuqq.cqrs.core.error;

/**
 * 낙관적 동시성 검사 실패.
 *
 * <p>저장 시 기대 버전이 현재 버전과 다를 때 발생하며, 이벤트는 하나도 추가되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConcurrencyException extends CqrsException {

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(String aggregateId, long expectedVersion, long actualVersion) {
        super(String.format(
            "Concurrency conflict on aggregate %s: expected version %d, actual %d",
            aggregateId, expectedVersion, actualVersion
        ));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
