package com.ryuqq.cqrs.application.saga;

import com.ryuqq.cqrs.application.support.BackoffCalculator;
import com.ryuqq.cqrs.core.error.SagaNotFoundException;
import com.ryuqq.cqrs.core.error.SagaTimeoutException;
import com.ryuqq.cqrs.core.model.Identifiers;
import com.ryuqq.cqrs.core.model.Payload;
import com.ryuqq.cqrs.core.saga.SagaContext;
import com.ryuqq.cqrs.core.saga.SagaDefinition;
import com.ryuqq.cqrs.core.saga.SagaStep;
import com.ryuqq.cqrs.core.statemachine.SagaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Saga 실행기.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * start(sagaId, data)
 *   ↓
 * RUNNING: 단계를 순서대로 실행
 *   - 단계 시작 전 Saga 전체 timeout 확인
 *   - 단계 실패 시 retries 만큼 backoff 후 재시도
 *   - 단계 timeout은 작업 스레드에서 대기, 초과 시 인터럽트 후 실패
 *   ↓
 * 모두 성공 → COMPLETED → onComplete
 * 실패       → COMPENSATING → 완료 단계 역순 보상 → FAILED → onFailed
 * </pre>
 *
 * <p>단계가 {@link Error}를 던지면 재시도 없이 같은 보상 경로로 FAILED까지 진행한 뒤,
 * 보관 처리 후 그 Error를 호출자에게 다시 던집니다.</p>
 *
 * <p><strong>보관 정책:</strong> 진행 중인 인스턴스는 항상 보관하고, 종료된 인스턴스는
 * 최근 {@code historyLimit}개까지만 보관합니다 (오래된 것부터 제거).</p>
 *
 * <p>{@link #start(String, Payload)}는 호출 스레드에서 Saga가 끝날 때까지 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SagaManager {

    private static final Logger log = LoggerFactory.getLogger(SagaManager.class);

    private final int historyLimit;
    private final BackoffCalculator backoffCalculator;
    private final Clock clock;
    private final ConcurrentHashMap<String, SagaDefinition> definitions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SagaContext> instances = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<String> finishedOrder = new ConcurrentLinkedDeque<>();
    private final ExecutorService stepExecutor;

    public SagaManager(int historyLimit) {
        this(historyLimit, BackoffCalculator.forSagaSteps(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param historyLimit 보관할 종료 인스턴스 최대 수 (0 이상)
     * @param backoffCalculator 단계 재시도 대기 계산기
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public SagaManager(int historyLimit, BackoffCalculator backoffCalculator, Clock clock) {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must be non-negative (current: " + historyLimit + ")");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.historyLimit = historyLimit;
        this.backoffCalculator = backoffCalculator;
        this.clock = clock;
        this.stepExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "cqrs-saga-step");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void register(SagaDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (definitions.put(definition.sagaId(), definition) != null) {
            log.warn("Overwriting saga definition {}", definition.sagaId());
        } else {
            log.info("Registered saga {} ({} step(s))", definition.sagaId(), definition.steps().size());
        }
    }

    /**
     * Saga 시작 (완료 또는 실패까지 실행).
     *
     * @param sagaId Saga 정의 ID
     * @param initialData 초기 데이터 (null이면 빈 Payload)
     * @return 종료된 Saga 컨텍스트
     * @throws SagaNotFoundException 등록되지 않은 sagaId인 경우
     * @throws Error 단계가 Error를 던진 경우 (Saga는 보상 후 FAILED)
     */
    public SagaContext start(String sagaId, Payload initialData) {
        SagaDefinition definition = definitions.get(sagaId);
        if (definition == null) {
            throw new SagaNotFoundException(sagaId);
        }

        SagaContext context = new SagaContext(
            sagaId, Identifiers.next("saga-" + sagaId), initialData, clock.instant()
        );
        instances.put(context.getInstanceId(), context);
        log.info("Started saga {} (instance={})", sagaId, context.getInstanceId());

        Throwable failure = runSteps(definition, context);
        if (failure == null) {
            complete(definition, context);
        } else {
            compensate(definition, context, failure);
        }
        retain(context.getInstanceId());
        if (failure instanceof Error error) {
            throw error;
        }
        return context;
    }

    public Optional<SagaContext> getInstance(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    /**
     * 진행 중(RUNNING, COMPENSATING)인 인스턴스 목록.
     */
    public List<SagaContext> getActiveInstances() {
        List<SagaContext> active = new ArrayList<>();
        for (SagaContext context : instances.values()) {
            if (context.getStatus().isActive()) {
                active.add(context);
            }
        }
        return Collections.unmodifiableList(active);
    }

    public int getRetainedInstanceCount() {
        return instances.size();
    }

    public void shutdown() {
        stepExecutor.shutdown();
        try {
            if (!stepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                stepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            stepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Throwable runSteps(SagaDefinition definition, SagaContext context) {
        for (SagaStep step : definition.steps()) {
            if (definition.timeout() != null
                && Duration.between(context.getStartedAt(), clock.instant()).compareTo(definition.timeout()) > 0) {
                return SagaTimeoutException.forSaga(definition.sagaId(), definition.timeout());
            }

            context.setCurrentStep(step.name());
            try {
                executeWithRetry(step, context);
            } catch (Exception e) {
                log.error("Saga {} step {} failed (instance={}): {}",
                    definition.sagaId(), step.name(), context.getInstanceId(), e.getMessage());
                return e;
            } catch (Error e) {
                log.error("Saga {} step {} raised an error (instance={})",
                    definition.sagaId(), step.name(), context.getInstanceId(), e);
                return e;
            }
            context.markStepCompleted(step.name());
            log.debug("Saga {} step {} completed (instance={})",
                definition.sagaId(), step.name(), context.getInstanceId());
        }
        return null;
    }

    private void executeWithRetry(SagaStep step, SagaContext context) throws Exception {
        int attempt = 0;
        while (true) {
            try {
                executeOnce(step, context);
                return;
            } catch (Exception e) {
                if (attempt >= step.retries() || Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                long delay = backoffCalculator.calculate(attempt + 1);
                attempt++;
                log.warn("Saga step {} failed, retry {}/{} in {}ms: {}",
                    step.name(), attempt, step.retries(), delay, e.getMessage());
                sleep(delay);
            }
        }
    }

    private void executeOnce(SagaStep step, SagaContext context) throws Exception {
        Duration timeout = step.timeout();
        if (timeout == null) {
            step.execute(context);
            return;
        }

        Future<?> future = stepExecutor.submit(() -> {
            step.execute(context);
            return null;
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw SagaTimeoutException.forStep(step.name(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private void complete(SagaDefinition definition, SagaContext context) {
        context.transitionTo(SagaStatus.COMPLETED);
        context.finish(clock.instant());
        log.info("Saga {} completed (instance={})", definition.sagaId(), context.getInstanceId());

        if (definition.onComplete() != null) {
            try {
                definition.onComplete().onComplete(context);
            } catch (Exception e) {
                log.error("onComplete callback of saga {} failed", definition.sagaId(), e);
            }
        }
    }

    private void compensate(SagaDefinition definition, SagaContext context, Throwable failure) {
        context.setError(failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName());
        context.transitionTo(SagaStatus.COMPENSATING);

        List<String> completed = new ArrayList<>(context.getCompletedSteps());
        Collections.reverse(completed);
        for (String stepName : completed) {
            SagaStep step = definition.findStep(stepName).orElseThrow();
            context.setCurrentStep(stepName);
            try {
                step.compensate(context);
                log.debug("Compensated step {} of saga {} (instance={})",
                    stepName, definition.sagaId(), context.getInstanceId());
            } catch (Exception e) {
                log.error("Compensation of step {} in saga {} failed (instance={})",
                    stepName, definition.sagaId(), context.getInstanceId(), e);
            }
        }

        context.transitionTo(SagaStatus.FAILED);
        context.finish(clock.instant());
        log.warn("Saga {} failed (instance={}): {}", definition.sagaId(), context.getInstanceId(), context.getError());

        if (definition.onFailed() != null) {
            try {
                definition.onFailed().onFailed(context, failure);
            } catch (Exception e) {
                log.error("onFailed callback of saga {} failed", definition.sagaId(), e);
            }
        }
    }

    private void retain(String instanceId) {
        finishedOrder.addLast(instanceId);
        while (finishedOrder.size() > historyLimit) {
            String evicted = finishedOrder.pollFirst();
            if (evicted == null) {
                break;
            }
            instances.remove(evicted);
        }
    }

    /**
     * 재시도 대기.
     *
     * <p>InterruptedException 발생 시 인터럽트 플래그를 복원합니다.
     * 다음 시도 실패 후 더 이상 재시도하지 않습니다.</p>
     */
    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
