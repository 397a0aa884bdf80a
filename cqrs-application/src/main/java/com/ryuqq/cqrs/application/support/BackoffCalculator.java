package com.ryuqq.cqrs.application.support;

import com.ryuqq.cqrs.core.config.CqrsEngineConfig;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재시도 대기 시간 계산기 (지수 백오프 + Jitter).
 *
 * <pre>
 * exponential = min(base * 2^(failedAttempts-1), max)
 * delay       = min(exponential + exponential * jitterFactor * random[0,1), max)
 * </pre>
 *
 * <p>CommandBus는 {@link #forCommands(CqrsEngineConfig)}로 엔진 설정을 따르고,
 * SagaManager는 {@link #forSagaSteps()} (1000ms부터 두 배씩, 30000ms 상한, jitter 없음)를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final long SAGA_BASE_DELAY_MS = 1000;
    private static final long SAGA_MAX_DELAY_MS = 30000;
    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * Saga 단계 재시도 간격으로 생성.
     */
    public BackoffCalculator() {
        this(SAGA_BASE_DELAY_MS, SAGA_MAX_DELAY_MS, 0.0);
    }

    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하여 생성.
     *
     * @param baseDelayMs 첫 재시도 전 대기 (0이면 대기 없음)
     * @param maxDelayMs 대기 상한 (baseDelayMs 이상)
     * @param jitterFactor 지수값 대비 jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be non-negative (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    public static BackoffCalculator forCommands(CqrsEngineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new BackoffCalculator(config.baseRetryDelayMs(), config.maxRetryDelayMs(), config.retryJitterFactor());
    }

    public static BackoffCalculator forSagaSteps() {
        return new BackoffCalculator();
    }

    /**
     * 실패한 시도 수에 대한 대기 시간.
     *
     * @param failedAttempts 지금까지 실패한 시도 수 (1부터)
     * @return 다음 시도 전 대기 (밀리초)
     * @throws IllegalArgumentException failedAttempts가 양수가 아닌 경우
     */
    public long calculate(int failedAttempts) {
        if (failedAttempts <= 0) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + failedAttempts + ")");
        }
        long exponential = Math.min(baseDelayMs << Math.min(failedAttempts - 1, MAX_SHIFT), maxDelayMs);
        if (exponential == 0 || jitterFactor == 0.0) {
            return exponential;
        }
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }
}
