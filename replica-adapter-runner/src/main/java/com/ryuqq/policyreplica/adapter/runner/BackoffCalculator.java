package com.ryuqq.policyreplica.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재구독 대기 시간 계산기 (Capped Exponential Backoff with Jitter).
 *
 * <p>저하된 저장소를 상대로 재구독을 반복할 때 대기 간격을 지수적으로 늘리되,
 * Jitter를 더해 여러 인스턴스가 동시에 재접속하는 것을 피합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attempt-1), maxDelay)
 * jitter      = random(0, exponential * jitterFactor)
 * delay       = min(exponential + jitter, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, maxDelay=30000ms, jitterFactor=0.2):</strong></p>
 * <ul>
 *   <li>attempt=1: 100-120ms</li>
 *   <li>attempt=2: 200-240ms</li>
 *   <li>attempt=5: 1600-1920ms</li>
 *   <li>attempt=20: 30000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * <p>시도 횟수에 상한이 없습니다. 재구독은 포기하지 않고 maxDelay 간격으로 계속됩니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=100ms, maxDelay=30000ms, jitterFactor=0.2</p>
     */
    public BackoffCalculator() {
        this(100, 30000, 0.2);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 주입하여 생성 (테스트용).
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 범위 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * ChangeFeedConfig의 백오프 설정으로 생성.
     *
     * @param config 설정
     * @return BackoffCalculator 인스턴스
     */
    public static BackoffCalculator from(ChangeFeedConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new BackoffCalculator(config.baseBackoffMs(), config.maxBackoffMs(), config.jitterFactor());
    }

    /**
     * 재구독 전 대기 시간 계산.
     *
     * @param attemptCount 연속 실패 횟수 (1부터 시작, 상한 없음)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // shift를 제한하여 long overflow 방지
        int shift = Math.min(attemptCount - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs << shift, maxDelayMs);
        if (exponential <= 0) {
            exponential = maxDelayMs;
        }

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
