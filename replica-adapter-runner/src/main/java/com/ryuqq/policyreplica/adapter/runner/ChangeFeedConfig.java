package com.ryuqq.policyreplica.adapter.runner;

/**
 * ChangeFeedConsumer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollTimeoutMs: 다음 이벤트 대기 1회 최대 시간, 취소 확인 주기이기도 함 (기본 500ms)</li>
 *   <li>baseBackoffMs: 첫 재구독 대기 시간 (기본 100ms)</li>
 *   <li>maxBackoffMs: 재구독 대기 시간 상한 (기본 30000ms)</li>
 *   <li>jitterFactor: 재구독 대기 Jitter 비율 (기본 0.2)</li>
 *   <li>shutdownTimeoutMs: close() 시 consumer 종료 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>빠른 취소 응답: pollTimeoutMs 감소 (500 → 100)</li>
 *   <li>저하된 저장소 보호: baseBackoffMs, maxBackoffMs 증가</li>
 * </ul>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 * @param pollTimeoutMs 이벤트 대기 시간 (밀리초, 양수여야 함)
 * @param baseBackoffMs 기본 재구독 대기 시간 (밀리초, 양수여야 함)
 * @param maxBackoffMs 최대 재구독 대기 시간 (밀리초, baseBackoffMs 이상이어야 함)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record ChangeFeedConfig(
    long pollTimeoutMs,
    long baseBackoffMs,
    long maxBackoffMs,
    double jitterFactor,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollTimeoutMs=500ms, baseBackoffMs=100ms, maxBackoffMs=30000ms,
     * jitterFactor=0.2, shutdownTimeoutMs=5000ms</p>
     */
    public ChangeFeedConfig() {
        this(500, 100, 30000, 0.2, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ChangeFeedConfig {
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "pollTimeoutMs must be positive (current: " + pollTimeoutMs + ")"
            );
        }
        if (baseBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "baseBackoffMs must be positive (current: " + baseBackoffMs + ")"
            );
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= baseBackoffMs (base: " + baseBackoffMs + ", max: " + maxBackoffMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * pollTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ChangeFeedConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new ChangeFeedConfig(pollTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor, shutdownTimeoutMs);
    }

    /**
     * baseBackoffMs만 변경한 새 인스턴스 생성.
     */
    public ChangeFeedConfig withBaseBackoffMs(long baseBackoffMs) {
        return new ChangeFeedConfig(pollTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor, shutdownTimeoutMs);
    }

    /**
     * maxBackoffMs만 변경한 새 인스턴스 생성.
     */
    public ChangeFeedConfig withMaxBackoffMs(long maxBackoffMs) {
        return new ChangeFeedConfig(pollTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor, shutdownTimeoutMs);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public ChangeFeedConfig withJitterFactor(double jitterFactor) {
        return new ChangeFeedConfig(pollTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ChangeFeedConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new ChangeFeedConfig(pollTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor, shutdownTimeoutMs);
    }
}
