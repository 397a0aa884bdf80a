package com.ryuqq.cqrs.application.engine;

import com.ryuqq.cqrs.application.aggregate.AggregateRepository;
import com.ryuqq.cqrs.application.command.CommandBus;
import com.ryuqq.cqrs.application.command.DispatchOutcome;
import com.ryuqq.cqrs.application.projection.ProjectionManager;
import com.ryuqq.cqrs.application.query.QueryBus;
import com.ryuqq.cqrs.application.saga.SagaManager;
import com.ryuqq.cqrs.application.support.BackoffCalculator;
import com.ryuqq.cqrs.core.config.CqrsEngineConfig;
import com.ryuqq.cqrs.core.contract.Command;
import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.contract.ProjectionDefinition;
import com.ryuqq.cqrs.core.contract.Query;
import com.ryuqq.cqrs.core.handler.CommandHandler;
import com.ryuqq.cqrs.core.handler.EventApplier;
import com.ryuqq.cqrs.core.handler.Middleware;
import com.ryuqq.cqrs.core.handler.QueryHandler;
import com.ryuqq.cqrs.core.handler.Subscription;
import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.outcome.CommandResult;
import com.ryuqq.cqrs.core.outcome.HandlerFailure;
import com.ryuqq.cqrs.core.outcome.QueryResult;
import com.ryuqq.cqrs.core.saga.SagaContext;
import com.ryuqq.cqrs.core.saga.SagaDefinition;
import com.ryuqq.cqrs.core.spi.DeadLetterEntry;
import com.ryuqq.cqrs.core.spi.DeadLetterQueue;
import com.ryuqq.cqrs.core.spi.DeduplicationStore;
import com.ryuqq.cqrs.core.spi.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * CQRS 엔진 파사드.
 *
 * <p>구성 루트(composition root)에서 한 번 생성하여 참조로 전달합니다.
 * 전역 싱글톤은 없습니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <pre>
 * CqrsEngine engine = new CqrsEngine(
 *     CqrsEngineConfig.defaults(),
 *     new InMemoryEventStore(),
 *     new InMemoryDeadLetterQueue(1000),
 *     new InMemoryDeduplicationStore()
 * );
 *
 * engine.registerAggregate("Order", Map.of("OrderCreated", applier));
 * engine.registerCommand("CreateOrder", handler);
 * CommandResult result = engine.dispatchCommand(command);
 * </pre>
 *
 * <p><strong>이벤트 흐름:</strong> Command 성공 → 결과 이벤트 발행 → EventStore 구독자
 * (ProjectionManager 포함). 멱등성 캐시로 반환된 결과는 다시 발행하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CqrsEngine {

    private static final Logger log = LoggerFactory.getLogger(CqrsEngine.class);

    private final EventStore eventStore;
    private final DeadLetterQueue deadLetterQueue;
    private final AggregateRepository repository;
    private final CommandBus commandBus;
    private final QueryBus queryBus;
    private final ProjectionManager projectionManager;
    private final SagaManager sagaManager;
    private final Subscription projectionSubscription;

    public CqrsEngine(
        CqrsEngineConfig config,
        EventStore eventStore,
        DeadLetterQueue deadLetterQueue,
        DeduplicationStore deduplicationStore
    ) {
        this(config, eventStore, deadLetterQueue, deduplicationStore, Clock.systemUTC(), BackoffCalculator.forSagaSteps());
    }

    /**
     * 생성자.
     *
     * @param config 엔진 설정
     * @param eventStore 이벤트 저장소
     * @param deadLetterQueue DLQ
     * @param deduplicationStore 멱등성 캐시
     * @param clock 시계
     * @param sagaBackoff Saga 단계 재시도 대기 계산기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CqrsEngine(
        CqrsEngineConfig config,
        EventStore eventStore,
        DeadLetterQueue deadLetterQueue,
        DeduplicationStore deduplicationStore,
        Clock clock,
        BackoffCalculator sagaBackoff
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        this.eventStore = eventStore;
        this.deadLetterQueue = deadLetterQueue;
        this.repository = new AggregateRepository(eventStore, config.snapshotInterval(), clock);
        this.commandBus = new CommandBus(config, deadLetterQueue, deduplicationStore, clock);
        this.queryBus = new QueryBus(config, clock);
        this.projectionManager = new ProjectionManager();
        this.sagaManager = new SagaManager(config.sagaHistoryLimit(), sagaBackoff, clock);
        this.projectionSubscription = eventStore.subscribeAll(new ProjectionSubscriber(projectionManager));

        log.info("CQRS engine started (snapshotInterval={}, maxRetries={}, queryCache={})",
            config.snapshotInterval(), config.maxRetries(), config.queryCacheEnabled());
    }

    // ========================================
    // Registration
    // ========================================

    public void registerCommand(String commandType, CommandHandler handler) {
        commandBus.register(commandType, handler);
    }

    public void registerQuery(String queryType, QueryHandler<?> handler) {
        queryBus.register(queryType, handler);
    }

    public void registerProjection(ProjectionDefinition definition) {
        projectionManager.register(definition);
    }

    public void registerSaga(SagaDefinition definition) {
        sagaManager.register(definition);
    }

    public void registerAggregate(String aggregateType, Map<String, EventApplier> eventAppliers) {
        repository.registerAggregate(aggregateType, eventAppliers);
    }

    public void useCommandMiddleware(Middleware middleware) {
        commandBus.use(middleware);
    }

    public void useQueryMiddleware(Middleware middleware) {
        queryBus.use(middleware);
    }

    // ========================================
    // Dispatch
    // ========================================

    /**
     * Command 디스패치 후 성공 이벤트 발행.
     *
     * @param command Command
     * @return 처리 결과
     */
    public CommandResult dispatchCommand(Command command) {
        DispatchOutcome outcome = commandBus.dispatchWithOutcome(command);
        if (!outcome.deduplicated()) {
            publish(outcome.result());
        }
        return outcome.result();
    }

    public QueryResult<Object> dispatchQuery(Query query) {
        return queryBus.dispatch(query);
    }

    public <T> QueryResult<T> dispatchQuery(Query query, Class<T> resultType) {
        return queryBus.dispatch(query, resultType);
    }

    public SagaContext startSaga(String sagaId, Payload initialData) {
        return sagaManager.start(sagaId, initialData);
    }

    public void replayProjection(String name) {
        projectionManager.rebuild(name, eventStore);
    }

    public Payload getProjectionState(String name) {
        return projectionManager.getState(name);
    }

    public void invalidateQueryCache(String queryType) {
        queryBus.invalidateCache(queryType);
    }

    /**
     * 미해결 DLQ 항목 재처리.
     *
     * <p>성공한 항목은 해결(resolve) 처리되고 이벤트가 발행됩니다.
     * 실패한 항목은 미해결로 남으며 DLQ에 다시 추가되지 않습니다.</p>
     *
     * @param filter 재처리 대상 조건 (null이면 전체)
     * @return 재처리 결과
     */
    public RetryReport retryDeadLetters(Predicate<DeadLetterEntry> filter) {
        int retried = 0;
        int succeeded = 0;
        for (DeadLetterEntry entry : deadLetterQueue.getUnresolved()) {
            if (filter != null && !filter.test(entry)) {
                continue;
            }
            retried++;
            CommandResult result = commandBus.replay(entry.command());
            if (result.success()) {
                deadLetterQueue.resolve(entry.id());
                publish(result);
                succeeded++;
            }
        }
        log.info("Retried {} dead letter(s), {} succeeded", retried, succeeded);
        return new RetryReport(retried, succeeded);
    }

    public RetryReport retryDeadLetters() {
        return retryDeadLetters(null);
    }

    // ========================================
    // Introspection
    // ========================================

    public EngineStats getStats() {
        return new EngineStats(
            eventStore.getEventCount(),
            commandBus.getRegisteredCommands().size(),
            queryBus.getRegisteredQueries().size(),
            projectionManager.listProjections().size(),
            sagaManager.getActiveInstances().size(),
            deadLetterQueue.size()
        );
    }

    public AggregateRepository getRepository() {
        return repository;
    }

    public EventStore getEventStore() {
        return eventStore;
    }

    public DeadLetterQueue getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public SagaManager getSagaManager() {
        return sagaManager;
    }

    public void shutdown() {
        projectionSubscription.unsubscribe();
        commandBus.shutdown();
        queryBus.shutdown();
        sagaManager.shutdown();
        log.info("CQRS engine stopped");
    }

    private void publish(CommandResult result) {
        if (!result.success() || !result.hasEvents()) {
            return;
        }
        List<DomainEvent> events = result.events();
        List<HandlerFailure> failures = eventStore.publish(events);
        for (HandlerFailure failure : failures) {
            log.warn("Subscriber {} failed on event {} ({}): {}",
                failure.source(), failure.eventId(), failure.eventType(), failure.message());
        }
    }
}
