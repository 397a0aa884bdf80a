package com.ryuqq.cqrs.core.saga;

import java.time.Duration;

/**
 * Saga를 구성하는 단일 단계.
 *
 * <p><strong>재시도:</strong> {@link #retries()}회까지 추가 시도하며, 시도 사이에
 * {@code min(1000 * 2^attempt, 30000)}ms 대기합니다.</p>
 *
 * <p><strong>타임아웃:</strong> {@link #timeout()}이 설정되면 단계는 작업 스레드에서 실행되고,
 * 제한 시간이 지나면 실패로 처리됩니다. 타임아웃은 "기다리기를 멈춘다"는 의미입니다.
 * 작업 스레드에 인터럽트를 보내지만, 인터럽트를 무시하는 단계는 백그라운드에서 계속 실행될 수 있습니다.</p>
 *
 * <p><strong>보상:</strong> {@link #compensate(SagaContext)}는 최선 노력(best-effort)이며,
 * 예외는 로그로만 남고 나머지 보상을 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SagaStep {

    /**
     * 단계 이름 (Saga 정의 내에서 고유).
     */
    String name();

    void execute(SagaContext context) throws Exception;

    void compensate(SagaContext context) throws Exception;

    /**
     * 최초 시도 이후 추가 재시도 횟수.
     *
     * @return 0 이상 (기본 0)
     */
    default int retries() {
        return 0;
    }

    /**
     * 단계 제한 시간.
     *
     * @return 제한 시간 (null이면 무제한)
     */
    default Duration timeout() {
        return null;
    }

    /**
     * 실행/보상 동작으로 단계 생성.
     *
     * @param name 단계 이름
     * @param execute 실행 동작
     * @param compensate 보상 동작
     * @return SagaStep 인스턴스
     */
    static SagaStep of(String name, SagaAction execute, SagaAction compensate) {
        return builder(name).execute(execute).compensate(compensate).build();
    }

    static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * SagaStep Builder.
     */
    final class Builder {

        private final String name;
        private SagaAction execute;
        private SagaAction compensate = context -> { };
        private int retries;
        private Duration timeout;

        private Builder(String name) {
            this.name = name;
        }

        public Builder execute(SagaAction execute) {
            this.execute = execute;
            return this;
        }

        public Builder compensate(SagaAction compensate) {
            this.compensate = compensate;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public SagaStep build() {
            return new DefaultSagaStep(name, execute, compensate, retries, timeout);
        }
    }
}
