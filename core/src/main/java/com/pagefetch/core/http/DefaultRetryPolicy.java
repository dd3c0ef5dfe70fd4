package com.pagefetch.core.http;

import java.time.Duration;
import java.util.Objects;

/**
 * 지수 백오프 정책: delay = base * multiplier^(attempt-1), 지터 적용 후 maxDelay로 상한.
 * 재시도 대상은 전송 예외(-1)와 429/5xx.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final double multiplier;
    private final Jitter jitter;
    private final long maxDelayMillis;

    /** 기본값: 12회, 10ms부터 2배, FULL 지터 */
    public DefaultRetryPolicy() {
        this(12, Duration.ofMillis(10), 2.0, Jitter.FULL, Duration.ofSeconds(30));
    }

    public DefaultRetryPolicy(int maxAttempts, Duration base, double multiplier, Jitter jitter, Duration maxDelay) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (base.isNegative() || base.isZero()) throw new IllegalArgumentException("base delay must be > 0");
        if (!(multiplier > 1.0)) throw new IllegalArgumentException("multiplier must be > 1");
        if (maxDelay.compareTo(base) < 0) throw new IllegalArgumentException("maxDelay must be >= base delay");
        this.maxAttempts = maxAttempts;
        this.baseMillis = base.toMillis();
        this.multiplier = multiplier;
        this.jitter = (jitter != null ? jitter : Jitter.NONE);
        this.maxDelayMillis = maxDelay.toMillis();
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return isTransient(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        int k = Math.max(0, attempt - 1);
        double raw = baseMillis * Math.pow(multiplier, k);     // 10, 20, 40...
        long capped = (long) Math.min(raw, (double) maxDelayMillis);
        return Duration.ofMillis(jitter.apply(capped));
    }

    @Override public int maxAttempts() { return maxAttempts; }

    @Override public Duration maxDelay() { return Duration.ofMillis(maxDelayMillis); }

    public Jitter jitter() { return jitter; }
}
