package com.yerin.notifyq.infra;

import java.time.Duration;

/**
 * 키당 최대 시도 횟수와 지수 백오프. attemptsMade 는 방금 실패한 시도를 포함한다.
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMillis, long backoffCapMillis, double jitterRatio) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, 60_000L, 3_600_000L, 0.0);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (baseBackoffMillis < 0 || backoffCapMillis < baseBackoffMillis) {
            throw new IllegalArgumentException("invalid backoff window");
        }
    }

    public boolean isExhausted(int attemptsMade) {
        return attemptsMade >= maxAttempts;
    }

    public Duration backoffAfter(int attemptsMade) {
        return Backoff.expJitter(attemptsMade - 1, baseBackoffMillis, backoffCapMillis, jitterRatio);
    }
}
