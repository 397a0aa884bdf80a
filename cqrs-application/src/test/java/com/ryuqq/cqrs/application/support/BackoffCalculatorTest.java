package com.ryuqq.cqrs.application.support;

import com.ryuqq.cqrs.core.config.CqrsEngineConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 기본값은_Saga_재시도_간격을_따름() {
        // given
        BackoffCalculator calculator = BackoffCalculator.forSagaSteps();

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(1000);
        assertThat(calculator.calculate(2)).isEqualTo(2000);
        assertThat(calculator.calculate(5)).isEqualTo(16000);
        assertThat(calculator.calculate(6)).isEqualTo(30000);
        assertThat(calculator.calculate(40)).isEqualTo(30000);
    }

    @Test
    void jitter가_있어도_지연은_지수값과_최대값_사이() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 5000, 0.1);

        // when & then
        for (int i = 0; i < 100; i++) {
            assertThat(calculator.calculate(1)).isBetween(100L, 110L);
            assertThat(calculator.calculate(2)).isBetween(200L, 220L);
            assertThat(calculator.calculate(7)).isEqualTo(5000L);
        }
    }

    @Test
    void jitter는_난수_비율만큼_더해짐() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 5000, 0.5, () -> 0.5);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(125L);
        assertThat(calculator.calculate(3)).isEqualTo(500L);
        assertThat(calculator.calculate(6)).isEqualTo(4000L);
    }

    @Test
    void Command_재시도_간격은_엔진_설정을_따름() {
        // given
        CqrsEngineConfig config = CqrsEngineConfig.defaults()
            .withBaseRetryDelayMs(50)
            .withMaxRetryDelayMs(300)
            .withRetryJitterFactor(0.0);

        // when
        BackoffCalculator calculator = BackoffCalculator.forCommands(config);

        // then
        assertThat(calculator.calculate(1)).isEqualTo(50L);
        assertThat(calculator.calculate(3)).isEqualTo(200L);
        assertThat(calculator.calculate(4)).isEqualTo(300L);
    }

    @Test
    void 기본_지연이_0이면_대기하지_않음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(0, 0, 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isZero();
        assertThat(calculator.calculate(10)).isZero();
    }

    @Test
    void 잘못된_파라미터는_예외() {
        // when & then
        assertThatThrownBy(() -> new BackoffCalculator(-1, 100, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 50, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs must be >= baseDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(100, 500, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 500, 0.1, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator().calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attemptCount must be positive");
    }
}
