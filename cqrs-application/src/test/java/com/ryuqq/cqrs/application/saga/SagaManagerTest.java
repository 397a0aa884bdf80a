package com.ryuqq.cqrs.application.saga;

import com.ryuqq.cqrs.application.support.BackoffCalculator;
import com.ryuqq.cqrs.core.error.SagaNotFoundException;
import com.ryuqq.cqrs.core.error.SagaTimeoutException;
import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.saga.SagaContext;
import com.ryuqq.cqrs.core.saga.SagaDefinition;
import com.ryuqq.cqrs.core.saga.SagaStep;
import com.ryuqq.cqrs.core.statemachine.SagaStatus;
import com.ryuqq.cqrs.testkit.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SagaManager 테스트.
 *
 * <ul>
 *   <li>[A 성공, B 성공, C 재시도 후 실패] → B, A 순서로 보상, FAILED</li>
 *   <li>단계 타임아웃과 Saga 전체 타임아웃</li>
 *   <li>콜백과 보관 정책</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SagaManagerTest {

    private MutableClock clock;
    private SagaManager manager;
    private List<String> trace;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        manager = new SagaManager(10, new BackoffCalculator(0, 0, 0.0), clock);
        trace = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    // ============================================================
    // 1. 실행과 보상
    // ============================================================

    @Test
    void 세번째_단계가_재시도_후_실패하면_역순으로_보상() {
        // given
        AtomicInteger cAttempts = new AtomicInteger();
        manager.register(SagaDefinition.of("order", "Order", List.of(
            step("A"),
            step("B"),
            SagaStep.builder("C")
                .execute(ctx -> {
                    cAttempts.incrementAndGet();
                    throw new IllegalStateException("shipping unavailable");
                })
                .compensate(ctx -> trace.add("compensate:C"))
                .retries(2)
                .build()
        )));

        // when
        SagaContext context = manager.start("order", Payload.empty());

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.FAILED);
        assertThat(cAttempts).hasValue(3);
        assertThat(context.getCompletedSteps()).containsExactly("A", "B");
        assertThat(trace).containsExactly("execute:A", "execute:B", "compensate:B", "compensate:A");
        assertThat(context.getError()).isEqualTo("shipping unavailable");
        assertThat(context.getFinishedAt()).isNotNull();
        assertThat(context.getCurrentStep()).isNull();
    }

    @Test
    void 모든_단계가_성공하면_COMPLETED와_onComplete() {
        // given
        AtomicReference<SagaContext> completed = new AtomicReference<>();
        manager.register(SagaDefinition.of("order", "Order", List.of(
            SagaStep.of("reserve", ctx -> ctx.put("reservationId", "r-" + ctx.get("orderId")), ctx -> { }),
            SagaStep.of("charge", ctx -> ctx.put("charged", ctx.get("reservationId") != null), ctx -> { })
        )).withOnComplete(completed::set));

        // when
        SagaContext context = manager.start("order", Payload.of("orderId", "o-1"));

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(context.getData().getString("reservationId")).isEqualTo("r-o-1");
        assertThat(context.getData().getBoolean("charged")).isTrue();
        assertThat(completed.get()).isSameAs(context);
        assertThat(context.getInstanceId()).startsWith("saga-order-");
        assertThat(manager.getInstance(context.getInstanceId())).containsSame(context);
    }

    @Test
    void 재시도로_성공한_단계는_완료로_기록() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        manager.register(SagaDefinition.of("order", "Order", List.of(
            SagaStep.builder("flaky")
                .execute(ctx -> {
                    if (attempts.incrementAndGet() < 2) {
                        throw new IllegalStateException("transient");
                    }
                })
                .retries(1)
                .build()
        )));

        // when
        SagaContext context = manager.start("order", Payload.empty());

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(context.getCompletedSteps()).containsExactly("flaky");
    }

    @Test
    void 보상_실패는_삼키고_나머지_보상을_계속() {
        // given
        manager.register(SagaDefinition.of("order", "Order", List.of(
            step("A"),
            SagaStep.of("B", ctx -> trace.add("execute:B"), ctx -> {
                throw new IllegalStateException("refund failed");
            }),
            SagaStep.of("C", ctx -> {
                throw new IllegalStateException("boom");
            }, ctx -> trace.add("compensate:C"))
        )));

        // when
        SagaContext context = manager.start("order", Payload.empty());

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.FAILED);
        assertThat(trace).containsExactly("execute:A", "execute:B", "compensate:A");
    }

    @Test
    void onFailed_콜백은_실패_원인을_받음() {
        // given
        AtomicReference<Throwable> cause = new AtomicReference<>();
        manager.register(SagaDefinition.of("order", "Order", List.of(
            SagaStep.of("A", ctx -> {
                throw new IllegalArgumentException("invalid card");
            }, ctx -> { })
        )).withOnFailed((ctx, error) -> cause.set(error)));

        // when
        manager.start("order", Payload.empty());

        // then
        assertThat(cause.get()).isInstanceOf(IllegalArgumentException.class).hasMessage("invalid card");
    }

    @Test
    void 단계가_Error를_던지면_보상_후_FAILED로_끝나고_Error를_전파() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<SagaContext> failed = new AtomicReference<>();
        manager.register(SagaDefinition.of("order", "Order", List.of(
            step("A"),
            SagaStep.builder("B")
                .execute(ctx -> {
                    attempts.incrementAndGet();
                    throw new LinkageError("broken classpath");
                })
                .retries(2)
                .build()
        )).withOnFailed((ctx, error) -> failed.set(ctx)));

        // when
        assertThatThrownBy(() -> manager.start("order", Payload.empty()))
            .isInstanceOf(LinkageError.class)
            .hasMessage("broken classpath");

        // then
        SagaContext context = failed.get();
        assertThat(context).isNotNull();
        assertThat(context.getStatus()).isEqualTo(SagaStatus.FAILED);
        assertThat(context.getError()).isEqualTo("broken classpath");
        assertThat(context.getFinishedAt()).isNotNull();
        assertThat(attempts).hasValue(1);
        assertThat(trace).containsExactly("execute:A", "compensate:A");
        assertThat(manager.getActiveInstances()).isEmpty();
        assertThat(manager.getInstance(context.getInstanceId())).isPresent();
    }

    @Test
    void 콜백_예외는_상태를_바꾸지_않음() {
        // given
        manager.register(SagaDefinition.of("order", "Order", List.of(step("A")))
            .withOnComplete(ctx -> {
                throw new IllegalStateException("listener broken");
            }));

        // when
        SagaContext context = manager.start("order", Payload.empty());

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.COMPLETED);
    }

    // ============================================================
    // 2. 타임아웃
    // ============================================================

    @Test
    void 단계_타임아웃은_실패로_처리하고_작업_스레드를_인터럽트() throws Exception {
        // given
        CountDownLatch interrupted = new CountDownLatch(1);
        manager.register(SagaDefinition.of("order", "Order", List.of(
            step("A"),
            SagaStep.builder("slow")
                .execute(ctx -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                })
                .timeout(Duration.ofMillis(50))
                .build()
        )));

        // when
        SagaContext context = manager.start("order", Payload.empty());

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.FAILED);
        assertThat(context.getError()).contains("slow").contains("timed out");
        assertThat(trace).containsExactly("execute:A", "compensate:A");
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void 타임아웃_안에_끝난_단계는_작업_스레드에서_성공() {
        // given
        AtomicReference<String> threadName = new AtomicReference<>();
        manager.register(SagaDefinition.of("order", "Order", List.of(
            SagaStep.builder("quick")
                .execute(ctx -> threadName.set(Thread.currentThread().getName()))
                .timeout(Duration.ofSeconds(5))
                .build()
        )));

        // when
        SagaContext context = manager.start("order", Payload.empty());

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(threadName.get()).isEqualTo("cqrs-saga-step");
    }

    @Test
    void Saga_전체_타임아웃을_넘기면_다음_단계를_실행하지_않음() {
        // given
        AtomicReference<Throwable> cause = new AtomicReference<>();
        manager.register(SagaDefinition.of("order", "Order", List.of(
            SagaStep.of("A", ctx -> {
                trace.add("execute:A");
                clock.advance(Duration.ofSeconds(2));
            }, ctx -> trace.add("compensate:A")),
            step("B")
        )).withTimeout(Duration.ofSeconds(1)).withOnFailed((ctx, error) -> cause.set(error)));

        // when
        SagaContext context = manager.start("order", Payload.empty());

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.FAILED);
        assertThat(trace).containsExactly("execute:A", "compensate:A");
        assertThat(cause.get()).isInstanceOf(SagaTimeoutException.class);
    }

    // ============================================================
    // 3. 조회와 보관
    // ============================================================

    @Test
    void 실행_중인_인스턴스는_활성_목록에_포함() {
        // given
        AtomicInteger activeDuringStep = new AtomicInteger();
        manager.register(SagaDefinition.of("order", "Order", List.of(
            SagaStep.of("observe", ctx -> activeDuringStep.set(manager.getActiveInstances().size()), ctx -> { })
        )));

        // when
        manager.start("order", Payload.empty());

        // then
        assertThat(activeDuringStep).hasValue(1);
        assertThat(manager.getActiveInstances()).isEmpty();
    }

    @Test
    void 종료된_인스턴스는_보관_한도까지만_유지() {
        // given
        manager.shutdown();
        manager = new SagaManager(2, new BackoffCalculator(0, 0, 0.0), clock);
        manager.register(SagaDefinition.of("order", "Order", List.of(step("A"))));

        // when
        SagaContext first = manager.start("order", Payload.empty());
        SagaContext second = manager.start("order", Payload.empty());
        SagaContext third = manager.start("order", Payload.empty());

        // then
        assertThat(manager.getInstance(first.getInstanceId())).isEmpty();
        assertThat(manager.getInstance(second.getInstanceId())).isPresent();
        assertThat(manager.getInstance(third.getInstanceId())).isPresent();
        assertThat(manager.getRetainedInstanceCount()).isEqualTo(2);
    }

    @Test
    void 보관_한도가_0이면_종료된_인스턴스를_보관하지_않음() {
        // given
        manager.shutdown();
        manager = new SagaManager(0, new BackoffCalculator(0, 0, 0.0), clock);
        manager.register(SagaDefinition.of("order", "Order", List.of(step("A"))));

        // when
        SagaContext context = manager.start("order", Payload.empty());

        // then
        assertThat(context.getStatus()).isEqualTo(SagaStatus.COMPLETED);
        assertThat(manager.getInstance(context.getInstanceId())).isEmpty();
    }

    @Test
    void 등록되지_않은_Saga는_SagaNotFoundException() {
        // when & then
        assertThatThrownBy(() -> manager.start("missing", Payload.empty()))
            .isInstanceOf(SagaNotFoundException.class)
            .hasMessageContaining("missing");
    }

    private SagaStep step(String name) {
        return SagaStep.of(name, ctx -> trace.add("execute:" + name), ctx -> trace.add("compensate:" + name));
    }
}
