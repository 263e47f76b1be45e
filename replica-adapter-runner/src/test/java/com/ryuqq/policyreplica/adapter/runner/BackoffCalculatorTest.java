package com.ryuqq.policyreplica.adapter.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @ParameterizedTest
    @CsvSource({
        "1, 100",
        "2, 200",
        "3, 400",
        "5, 1600",
        "9, 25600",
        "10, 30000",
        "100, 30000"
    })
    void calculate_Jitter없으면_지수_증가_후_상한(int attempt, long expected) {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 30000, 0.2, () -> 0.0);

        // when & then
        assertThat(calculator.calculate(attempt)).isEqualTo(expected);
    }

    @Test
    void calculate_최대_Jitter도_상한을_넘지_않음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 30000, 0.2, () -> 0.999);

        // when & then
        assertThat(calculator.calculate(1)).isBetween(100L, 120L);
        assertThat(calculator.calculate(9)).isEqualTo(30000L);
        assertThat(calculator.calculate(Integer.MAX_VALUE)).isEqualTo(30000L);
    }

    @Test
    void calculate_기본_난수는_범위_안의_값() {
        BackoffCalculator calculator = new BackoffCalculator();

        for (int i = 0; i < 100; i++) {
            assertThat(calculator.calculate(3)).isBetween(400L, 480L);
        }
    }

    @Test
    void calculate_attempt가_양수가_아니면_예외() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attemptCount must be positive");
    }

    @Test
    void 생성자_파라미터_검증() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 100, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 50, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 1000, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void from_설정값을_사용() {
        ChangeFeedConfig config = new ChangeFeedConfig().withBaseBackoffMs(50).withMaxBackoffMs(500);

        BackoffCalculator calculator = BackoffCalculator.from(config);

        assertThat(calculator.getBaseDelayMs()).isEqualTo(50);
        assertThat(calculator.getMaxDelayMs()).isEqualTo(500);
        assertThat(calculator.getJitterFactor()).isEqualTo(0.2);
    }
}
