package com.ryuqq.cqrs.application.engine;

import com.ryuqq.cqrs.adapter.inmemory.dedup.InMemoryDeduplicationStore;
import com.ryuqq.cqrs.adapter.inmemory.dlq.InMemoryDeadLetterQueue;
import com.ryuqq.cqrs.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.cqrs.application.aggregate.AggregateState;
import com.ryuqq.cqrs.application.middleware.ValidationMiddleware;
import com.ryuqq.cqrs.application.support.BackoffCalculator;
import com.ryuqq.cqrs.core.config.CqrsEngineConfig;
import com.ryuqq.cqrs.core.contract.Command;
import com.ryuqq.cqrs.core.contract.CommandMetadata;
import com.ryuqq.cqrs.core.contract.DomainEvent;
import com.ryuqq.cqrs.core.contract.EventMetadata;
import com.ryuqq.cqrs.core.contract.ProjectionDefinition;
import com.ryuqq.cqrs.core.contract.Query;
import com.ryuqq.cqrs.core.handler.CommandHandler;
import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.model.PayloadSchema;
import com.ryuqq.cqrs.core.outcome.CommandResult;
import com.ryuqq.cqrs.core.outcome.ErrorCode;
import com.ryuqq.cqrs.core.outcome.QueryResult;
import com.ryuqq.cqrs.core.saga.SagaContext;
import com.ryuqq.cqrs.core.saga.SagaDefinition;
import com.ryuqq.cqrs.core.saga.SagaStep;
import com.ryuqq.cqrs.core.spi.DeadLetterEntry;
import com.ryuqq.cqrs.core.statemachine.SagaStatus;
import com.ryuqq.cqrs.testkit.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CqrsEngine 통합 테스트 (인메모리 어댑터).
 *
 * <p>Command → Aggregate 저장 → 이벤트 발행 → Projection → Query 흐름과
 * DLQ 재처리, Saga 실행을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CqrsEngineTest {

    private MutableClock clock;
    private InMemoryEventStore eventStore;
    private InMemoryDeadLetterQueue deadLetterQueue;
    private CqrsEngine engine;
    private AtomicBoolean gatewayDown;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        eventStore = new InMemoryEventStore();
        deadLetterQueue = new InMemoryDeadLetterQueue(10, clock);
        CqrsEngineConfig config = CqrsEngineConfig.defaults()
            .withMaxRetries(1)
            .withBaseRetryDelayMs(0)
            .withRetryJitterFactor(0.0);
        engine = new CqrsEngine(
            config, eventStore, deadLetterQueue, new InMemoryDeduplicationStore(),
            clock, new BackoffCalculator(0, 0, 0.0)
        );
        gatewayDown = new AtomicBoolean(false);

        engine.registerAggregate("order", Map.of(
            "OrderCreated", (state, event) -> state
                .with("status", "created")
                .with("total", event.payload().get("total")),
            "OrderCancelled", (state, event) -> state.with("status", "cancelled")
        ));
        engine.registerCommand("CreateOrder", orderHandler("OrderCreated"));
        engine.registerCommand("CancelOrder", orderHandler("OrderCancelled"));
        engine.registerProjection(ProjectionDefinition.of("order-summary", Set.of("OrderCreated", "OrderCancelled"),
            (event, state) -> state.with(event.aggregateId(), event.eventType()), Payload.empty()));
        engine.registerQuery("OrderSummary", (query, ctx) ->
            engine.getProjectionState("order-summary").get(query.params().getString("orderId")));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void Command_처리_후_Aggregate_상태와_Projection이_갱신됨() {
        // when
        CommandResult result = engine.dispatchCommand(createOrder("order-1", 100, null));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.aggregateVersion()).isEqualTo(1);
        assertThat(result.events()).singleElement()
            .satisfies(event -> assertThat(event.version()).isEqualTo(1));

        AggregateState loaded = engine.getRepository().load("order-1", "order");
        assertThat(loaded.version()).isEqualTo(1);
        assertThat(loaded.state()).isEqualTo(Payload.builder().put("status", "created").put("total", 100).build());

        QueryResult<String> summary = engine.dispatchQuery(
            Query.create("OrderSummary", Payload.of("orderId", "order-1")), String.class
        );
        assertThat(summary.data()).isEqualTo("OrderCreated");
    }

    @Test
    void 중복_Command는_이벤트를_다시_발행하지_않음() {
        // given
        AtomicInteger published = new AtomicInteger();
        eventStore.subscribe("OrderCreated", event -> published.incrementAndGet());
        Command first = createOrder("order-1", 100, "req-1");
        Command duplicate = createOrder("order-1", 100, "req-1");

        // when
        CommandResult firstResult = engine.dispatchCommand(first);
        CommandResult secondResult = engine.dispatchCommand(duplicate);

        // then
        assertThat(secondResult).isEqualTo(firstResult);
        assertThat(published).hasValue(1);
        assertThat(eventStore.getEventCount()).isEqualTo(1);
    }

    @Test
    void 구독자_실패는_Command_결과에_영향_없음() {
        // given
        eventStore.subscribeAll(event -> {
            throw new IllegalStateException("mailer down");
        });

        // when
        CommandResult result = engine.dispatchCommand(createOrder("order-1", 100, null));

        // then
        assertThat(result.success()).isTrue();
        assertThat(engine.getProjectionState("order-summary").getString("order-1")).isEqualTo("OrderCreated");
    }

    @Test
    void 검증_미들웨어가_잘못된_Command를_중단() {
        // given
        engine.useCommandMiddleware(new ValidationMiddleware().register("CreateOrder",
            PayloadSchema.builder().required("total", Number.class).build()));

        // when
        CommandResult result = engine.dispatchCommand(
            Command.create("CreateOrder", "order-1", Payload.of("total", "lots"))
        );

        // then
        assertThat(result.errorCode()).isEqualTo(ErrorCode.MIDDLEWARE_ABORTED);
        assertThat(result.error()).startsWith("Validation failed:");
        assertThat(eventStore.getEventCount()).isZero();
    }

    // ============================================================
    // DLQ 재처리
    // ============================================================

    @Test
    void 재시도_소진된_Command는_DLQ로_가고_재처리_성공_시_해결됨() {
        // given
        gatewayDown.set(true);
        CommandResult failed = engine.dispatchCommand(createOrder("order-1", 100, null));
        DeadLetterEntry entry = deadLetterQueue.getUnresolved().get(0);

        // when
        gatewayDown.set(false);
        RetryReport report = engine.retryDeadLetters();

        // then
        assertThat(failed.errorCode()).isEqualTo(ErrorCode.RETRIES_EXHAUSTED);
        assertThat(entry.retryCount()).isEqualTo(2);
        assertThat(report).isEqualTo(new RetryReport(1, 1));
        assertThat(deadLetterQueue.size()).isZero();
        assertThat(deadLetterQueue.getById(entry.id()).orElseThrow().resolved()).isTrue();
        assertThat(engine.getProjectionState("order-summary").getString("order-1")).isEqualTo("OrderCreated");
    }

    @Test
    void 재처리가_실패하면_항목은_중복_없이_미해결로_남음() {
        // given
        gatewayDown.set(true);
        engine.dispatchCommand(createOrder("order-1", 100, null));

        // when
        RetryReport report = engine.retryDeadLetters();

        // then
        assertThat(report.retried()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(deadLetterQueue.getAll()).hasSize(1);
        assertThat(deadLetterQueue.size()).isEqualTo(1);
    }

    @Test
    void 필터에_맞는_항목만_재처리() {
        // given
        gatewayDown.set(true);
        engine.dispatchCommand(createOrder("order-1", 100, null));
        engine.dispatchCommand(createOrder("order-2", 200, null));
        gatewayDown.set(false);

        // when
        RetryReport report = engine.retryDeadLetters(entry -> entry.command().aggregateId().equals("order-2"));

        // then
        assertThat(report).isEqualTo(new RetryReport(1, 1));
        assertThat(deadLetterQueue.getUnresolved()).singleElement()
            .satisfies(entry -> assertThat(entry.command().aggregateId()).isEqualTo("order-1"));
    }

    // ============================================================
    // Projection 재구성 / Saga / 통계
    // ============================================================

    @Test
    void 나중에_등록한_Projection은_재구성으로_따라잡음() {
        // given
        engine.dispatchCommand(createOrder("order-1", 100, null));
        engine.dispatchCommand(createOrder("order-2", 50, null));
        engine.registerProjection(ProjectionDefinition.of("order-count", Set.of("OrderCreated"),
            (event, state) -> state.with("count", state.getNumber("count").intValue() + 1), Payload.of("count", 0)));

        // when
        engine.replayProjection("order-count");

        // then
        assertThat(engine.getProjectionState("order-count").getNumber("count")).isEqualTo(2);
    }

    @Test
    void Saga_단계에서_Command를_디스패치하고_실패_시_보상() {
        // given
        engine.registerSaga(SagaDefinition.of("checkout", "Checkout", List.of(
            SagaStep.of("create",
                ctx -> engine.dispatchCommand(createOrder(ctx.get("orderId").toString(), 10, null)),
                ctx -> engine.dispatchCommand(Command.create("CancelOrder", ctx.get("orderId").toString(), Payload.empty()))),
            SagaStep.of("charge", ctx -> {
                throw new IllegalStateException("card declined");
            }, ctx -> { })
        )));

        // when
        SagaContext saga = engine.startSaga("checkout", Payload.of("orderId", "order-9"));

        // then
        assertThat(saga.getStatus()).isEqualTo(SagaStatus.FAILED);
        assertThat(engine.getRepository().load("order-9", "order").state().getString("status")).isEqualTo("cancelled");
        assertThat(engine.getProjectionState("order-summary").getString("order-9")).isEqualTo("OrderCancelled");
    }

    @Test
    void 통계는_각_구성요소의_현황을_모음() {
        // given
        engine.dispatchCommand(createOrder("order-1", 100, null));
        gatewayDown.set(true);
        engine.dispatchCommand(createOrder("order-2", 100, null));

        // when
        EngineStats stats = engine.getStats();

        // then
        assertThat(stats).isEqualTo(new EngineStats(1, 2, 1, 1, 0, 1));
    }

    @Test
    void shutdown하면_Projection_구독이_해제됨() {
        // given
        int before = eventStore.subscriberCount();

        // when
        engine.shutdown();

        // then
        assertThat(before).isEqualTo(1);
        assertThat(eventStore.subscriberCount()).isZero();
    }

    private CommandHandler orderHandler(String eventType) {
        return (command, ctx) -> {
            if (gatewayDown.get()) {
                throw new IllegalStateException("gateway down");
            }
            AggregateState current = engine.getRepository().load(command.aggregateId(), "order");
            DomainEvent event = DomainEvent.create(
                command.aggregateId(), "order", eventType, current.nextVersion(),
                command.payload(), EventMetadata.causedBy(command)
            );
            long version = engine.getRepository().save(command.aggregateId(), "order", List.of(event), current.version());
            return CommandResult.success(command.commandId(), List.of(event), version);
        };
    }

    private static Command createOrder(String orderId, int total, String idempotencyKey) {
        CommandMetadata metadata = CommandMetadata.create();
        if (idempotencyKey != null) {
            metadata = metadata.withIdempotencyKey(idempotencyKey);
        }
        return Command.create("CreateOrder", orderId, Payload.of("total", total), metadata);
    }
}
