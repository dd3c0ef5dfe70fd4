package com.pagefetch.core.model;

import com.pagefetch.core.http.DefaultRetryPolicy;
import com.pagefetch.core.http.Jitter;
import com.pagefetch.core.http.RetryPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 페치 설정 (fetch.yml 매핑 대상). 순수 설정 보관용.
 * 기본값: 5초 타임아웃, 워커 5개, 12회 시도, 10ms 부터 2배씩 대기(FULL 지터).
 */
public final class FetchConfig {

    /** YAML `retry:` 섹션과 매핑 */
    public static final class RetryCfg {
        private int maxAttempts = 12;
        private long baseDelayMs = 10;
        private double multiplier = 2.0;
        private Jitter jitter = Jitter.FULL;
        private long maxDelayMs = 30_000;

        public int getMaxAttempts() { return maxAttempts; }
        public RetryCfg setMaxAttempts(int v) { this.maxAttempts = v; return this; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public RetryCfg setBaseDelayMs(long v) { this.baseDelayMs = v; return this; }

        public double getMultiplier() { return multiplier; }
        public RetryCfg setMultiplier(double v) { this.multiplier = v; return this; }

        public Jitter getJitter() { return jitter; }
        public RetryCfg setJitter(Jitter v) { this.jitter = (v != null ? v : Jitter.FULL); return this; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public RetryCfg setMaxDelayMs(long v) { this.maxDelayMs = v; return this; }
    }

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0";

    /** retry.maxDelayMs 상한 (1시간) */
    public static final long MAX_RETRY_DELAY_MS = 3_600_000L;

    // ---------- 기본 필드 ----------
    private int poolSize = 5;                         // 배치 동시 요청 상한
    private Duration timeout = Duration.ofSeconds(5); // 시도당 타임아웃
    private boolean followRedirects = true;
    private boolean shareSession = false;             // true면 배치 전체가 세션 하나를 공유
    private Map<String, String> defaultHeaders = defaultHeaderSet();
    private RetryCfg retry = new RetryCfg();

    // ---------- getters ----------
    public int getPoolSize() { return poolSize; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public boolean isShareSession() { return shareSession; }
    public Map<String, String> getDefaultHeaders() { return defaultHeaders; }
    public RetryCfg getRetry() { return retry; }

    // ---------- fluent setters ----------
    public FetchConfig setPoolSize(int poolSize) { this.poolSize = Math.max(1, poolSize); return this; }
    public FetchConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public FetchConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public FetchConfig setShareSession(boolean v) { this.shareSession = v; return this; }
    public FetchConfig setRetry(RetryCfg retry) { this.retry = (retry != null ? retry : new RetryCfg()); return this; }

    /** null이면 빈 헤더 셋(기본 헤더 없음)으로 취급 */
    public FetchConfig setDefaultHeaders(Map<String, String> headers) {
        this.defaultHeaders = (headers == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        return this;
    }

    public FetchConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public long getTimeoutMs() { return timeout.toMillis(); }

    // ---------- validate ----------
    public void validate() {
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(defaultHeaders, "defaultHeaders");
        Objects.requireNonNull(retry, "retry");
        if (retry.getMaxAttempts() < 1)
            throw new IllegalArgumentException("retry.maxAttempts must be >= 1");
        if (retry.getBaseDelayMs() <= 0)
            throw new IllegalArgumentException("retry.baseDelayMs must be > 0");
        if (!(retry.getMultiplier() > 1.0))
            throw new IllegalArgumentException("retry.multiplier must be > 1");
        if (retry.getMaxDelayMs() < retry.getBaseDelayMs())
            throw new IllegalArgumentException("retry.maxDelayMs must be >= retry.baseDelayMs");
        if (retry.getMaxDelayMs() > MAX_RETRY_DELAY_MS)
            throw new IllegalArgumentException("retry.maxDelayMs must be <= " + MAX_RETRY_DELAY_MS);
    }

    // ---------- helpers ----------
    public static FetchConfig defaults() { return new FetchConfig(); }

    /** retry 섹션으로 정책 인스턴스 생성 (정책 자체는 무상태라 공유 가능) */
    public RetryPolicy retryPolicy() {
        return new DefaultRetryPolicy(
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getBaseDelayMs()),
                retry.getMultiplier(),
                retry.getJitter(),
                Duration.ofMillis(retry.getMaxDelayMs()));
    }

    private static Map<String, String> defaultHeaderSet() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", DEFAULT_USER_AGENT);
        return Collections.unmodifiableMap(h);
    }
}
