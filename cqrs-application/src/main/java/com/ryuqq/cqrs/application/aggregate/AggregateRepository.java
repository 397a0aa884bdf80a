package com.ryuqq.cqrs.application.aggregate;

import com.ryuqq.cqrs.core.contract.AggregateSnapshot;
import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.error.ConcurrencyException;
import com.ryuqq.cqrs.core.handler.EventApplier;
import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.spi.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 이벤트 재생 기반 Aggregate 저장소.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>스냅샷 + 이후 이벤트 재생으로 Aggregate 상태 복원</li>
 *   <li>낙관적 동시성 검사 후 이벤트 추가</li>
 *   <li>버전 연속성 검증 (expectedVersion + 1부터 빈틈 없이)</li>
 *   <li>snapshotInterval 배수 버전에 도달하면 동기적으로 스냅샷 생성</li>
 * </ul>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>Aggregate별 {@link ReentrantLock}으로 load/save를 직렬화</li>
 *   <li>같은 expectedVersion으로 동시에 save하면 정확히 하나만 성공</li>
 *   <li>서로 다른 Aggregate는 병렬로 처리</li>
 * </ul>
 *
 * <p><strong>버전 캐시:</strong> 처음 접근하는 Aggregate의 현재 버전은 EventStore에서
 * 초기화되므로, 재시작 후에도 이미 저장된 이벤트와 충돌하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AggregateRepository {

    private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

    private final EventStore eventStore;
    private final int snapshotInterval;
    private final Clock clock;
    private final Map<String, Map<String, EventApplier>> appliers = new ConcurrentHashMap<>();
    private final Map<String, Long> versions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public AggregateRepository(EventStore eventStore, int snapshotInterval) {
        this(eventStore, snapshotInterval, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param eventStore 이벤트 저장소
     * @param snapshotInterval 스냅샷 주기 (양수)
     * @param clock 스냅샷 시각용 시계
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public AggregateRepository(EventStore eventStore, int snapshotInterval, Clock clock) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (snapshotInterval <= 0) {
            throw new IllegalArgumentException("snapshotInterval must be positive (current: " + snapshotInterval + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.eventStore = eventStore;
        this.snapshotInterval = snapshotInterval;
        this.clock = clock;
    }

    /**
     * 이벤트 적용 함수 등록 ((aggregateType, eventType)당 하나, 재등록 시 교체).
     *
     * @param aggregateType Aggregate 유형
     * @param eventType 이벤트 유형
     * @param applier 순수 fold 함수
     */
    public void registerApplier(String aggregateType, String eventType, EventApplier applier) {
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType cannot be null or blank");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (applier == null) {
            throw new IllegalArgumentException("applier cannot be null");
        }
        appliers.computeIfAbsent(aggregateType, type -> new ConcurrentHashMap<>()).put(eventType, applier);
        log.debug("Registered applier {}/{}", aggregateType, eventType);
    }

    /**
     * Aggregate 유형의 적용 함수 일괄 등록.
     *
     * @param aggregateType Aggregate 유형
     * @param eventAppliers 이벤트 유형 → 적용 함수
     */
    public void registerAggregate(String aggregateType, Map<String, EventApplier> eventAppliers) {
        if (eventAppliers == null) {
            throw new IllegalArgumentException("eventAppliers cannot be null");
        }
        eventAppliers.forEach((eventType, applier) -> registerApplier(aggregateType, eventType, applier));
        log.info("Registered aggregate {} with {} applier(s)", aggregateType, eventAppliers.size());
    }

    /**
     * Aggregate 상태 복원.
     *
     * <p>스냅샷이 있으면 그 상태와 버전에서 시작하고, 이후 이벤트를 순서대로 적용합니다.
     * 적용 함수가 없는 이벤트는 상태를 바꾸지 않고 버전만 진행시킵니다.</p>
     *
     * @param aggregateId Aggregate ID
     * @param aggregateType Aggregate 유형
     * @return 상태와 버전
     */
    public AggregateState load(String aggregateId, String aggregateType) {
        requireId(aggregateId);
        ReentrantLock lock = lockFor(aggregateId);
        lock.lock();
        try {
            AggregateState state = replay(aggregateId, aggregateType);
            versions.put(aggregateId, state.version());
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 이벤트 저장.
     *
     * <p><strong>처리 순서:</strong></p>
     * <ol>
     *   <li>expectedVersion과 현재 버전 비교 (불일치 시 {@link ConcurrencyException}, 추가 없음)</li>
     *   <li>이벤트 소속 및 버전 연속성 검증</li>
     *   <li>EventStore에 추가, 현재 버전 갱신</li>
     *   <li>새 버전이 snapshotInterval의 배수이면 스냅샷 저장</li>
     * </ol>
     *
     * @param aggregateId Aggregate ID
     * @param aggregateType Aggregate 유형
     * @param events 추가할 이벤트 (빈 목록이면 아무것도 하지 않음)
     * @param expectedVersion 호출자가 본 버전
     * @return 저장 후 버전
     * @throws ConcurrencyException 버전 불일치
     * @throws IllegalArgumentException 이벤트가 다른 Aggregate 소속이거나 버전이 연속되지 않는 경우
     */
    public long save(String aggregateId, String aggregateType, List<DomainEvent> events, long expectedVersion) {
        requireId(aggregateId);
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }

        ReentrantLock lock = lockFor(aggregateId);
        lock.lock();
        try {
            long current = currentVersion(aggregateId);
            if (expectedVersion != current) {
                log.debug("Rejected save on {}: expected {}, actual {}", aggregateId, expectedVersion, current);
                throw new ConcurrencyException(aggregateId, expectedVersion, current);
            }
            if (events.isEmpty()) {
                return current;
            }
            validateSequence(aggregateId, events, expectedVersion);

            eventStore.append(events);
            long newVersion = events.get(events.size() - 1).version();
            versions.put(aggregateId, newVersion);
            log.debug("Saved {} event(s) to {} ({} → {})", events.size(), aggregateId, expectedVersion, newVersion);

            if (newVersion % snapshotInterval == 0) {
                takeSnapshot(aggregateId, aggregateType);
            }
            return newVersion;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 추적 중인 버전 (저장된 이벤트가 없으면 0).
     *
     * @param aggregateId Aggregate ID
     * @return 현재 버전
     */
    public long getCurrentVersion(String aggregateId) {
        requireId(aggregateId);
        ReentrantLock lock = lockFor(aggregateId);
        lock.lock();
        try {
            return currentVersion(aggregateId);
        } finally {
            lock.unlock();
        }
    }

    private AggregateState replay(String aggregateId, String aggregateType) {
        Optional<AggregateSnapshot> snapshot = eventStore.getSnapshot(aggregateId);
        Payload state = snapshot.map(AggregateSnapshot::state).orElse(Payload.empty());
        long version = snapshot.map(AggregateSnapshot::version).orElse(0L);

        Map<String, EventApplier> typeAppliers = appliers.getOrDefault(aggregateType, Map.of());
        for (DomainEvent event : eventStore.getEventsForAggregate(aggregateId, version)) {
            EventApplier applier = typeAppliers.get(event.eventType());
            if (applier != null) {
                state = applier.apply(state, event);
            }
            version = event.version();
        }
        return new AggregateState(state, version);
    }

    private void takeSnapshot(String aggregateId, String aggregateType) {
        AggregateState state = replay(aggregateId, aggregateType);
        eventStore.saveSnapshot(new AggregateSnapshot(
            aggregateId, aggregateType, state.version(), state.state(), clock.instant()
        ));
    }

    private long currentVersion(String aggregateId) {
        return versions.computeIfAbsent(aggregateId, this::lastStoredVersion);
    }

    private long lastStoredVersion(String aggregateId) {
        long version = eventStore.getSnapshot(aggregateId).map(AggregateSnapshot::version).orElse(0L);
        List<DomainEvent> tail = eventStore.getEventsForAggregate(aggregateId, version);
        return tail.isEmpty() ? version : tail.get(tail.size() - 1).version();
    }

    private static void validateSequence(String aggregateId, List<DomainEvent> events, long expectedVersion) {
        long expected = expectedVersion + 1;
        for (DomainEvent event : events) {
            if (event == null) {
                throw new IllegalArgumentException("events cannot contain null");
            }
            if (!aggregateId.equals(event.aggregateId())) {
                throw new IllegalArgumentException(
                    "event " + event.eventId() + " belongs to " + event.aggregateId() + ", not " + aggregateId
                );
            }
            if (event.version() != expected) {
                throw new IllegalArgumentException(
                    "event " + event.eventId() + " has version " + event.version() + ", expected " + expected
                );
            }
            expected++;
        }
    }

    private ReentrantLock lockFor(String aggregateId) {
        return locks.computeIfAbsent(aggregateId, id -> new ReentrantLock());
    }

    private static void requireId(String aggregateId) {
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId cannot be null or blank");
        }
    }
}
