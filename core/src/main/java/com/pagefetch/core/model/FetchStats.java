package com.pagefetch.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 배치 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class FetchStats {
    private final AtomicLong attemptsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함) 총합
    private final AtomicLong completed     = new AtomicLong(0);   // 성공으로 끝난 요청
    private final AtomicLong failed        = new AtomicLong(0);   // 소진으로 끝난 요청
    private final AtomicLong wallMsTotal   = new AtomicLong(0);   // 요청별 벽시계(재시도 대기 포함) 합
    private final AtomicInteger inFlight   = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** 워커 슬롯 진입. 현재 동시 실행 수를 반환. */
    public int enter() {
        int cur = inFlight.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(cur, Math::max);
        return cur;
    }

    public void exit() {
        inFlight.decrementAndGet();
    }

    public void record(FetchResult<?> result, long wallMs) {
        attemptsTotal.addAndGet(Math.max(0, result.getAttempts()));
        wallMsTotal.addAndGet(Math.max(0, wallMs));
        if (result.isSuccess()) completed.incrementAndGet(); else failed.incrementAndGet();
    }

    public Snapshot snapshot() {
        long done = completed.get() + failed.get();
        long attempts = attemptsTotal.get();
        long retries = Math.max(0, attempts - done);
        long avgMs = done == 0 ? 0 : wallMsTotal.get() / done;
        return new Snapshot(attempts, retries, completed.get(), failed.get(), maxObservedConcurrency.get(), avgMs);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long attemptsTotal;
        public final long retriesTotal;
        public final long completed;
        public final long failed;
        public final int  maxObservedConcurrency;
        public final long avgFetchMs;

        Snapshot(long attempts, long retries, long completed, long failed, int maxCC, long avgMs) {
            this.attemptsTotal = attempts;
            this.retriesTotal = retries;
            this.completed = completed;
            this.failed = failed;
            this.maxObservedConcurrency = maxCC;
            this.avgFetchMs = avgMs;
        }

        @Override public String toString() {
            return "attempts=" + attemptsTotal + ", retries=" + retriesTotal + ", completed=" + completed
                    + ", failed=" + failed + ", maxCC=" + maxObservedConcurrency + ", avgMs=" + avgFetchMs;
        }
    }
}
