package com.yerin.notifyq.infra;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private Backoff() {}

    /**
     * base * 2^retryCount, cap 으로 자르고 ±jitterRatio 를 곱한다.
     * retryCount 0 이 첫 재시도다.
     */
    public static Duration expJitter(int retryCount, long baseMillis, long capMillis, double jitterRatio) {
        int exponent = Math.min(Math.max(0, retryCount), 30);
        long exp = (long) (baseMillis * Math.pow(2, exponent));
        long capped = Math.min(exp, capMillis);
        if (jitterRatio <= 0.0) return Duration.ofMillis(capped);
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterRatio; // 1±r
        long withJitter = Math.max(0, (long) (capped * jitter));
        return Duration.ofMillis(withJitter);
    }
}
