package com.pagefetch.core.service;

import com.pagefetch.core.api.IFetchSession;
import com.pagefetch.core.exception.FetchException;
import com.pagefetch.core.model.FetchResult;
import com.pagefetch.core.model.FetchStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 디스패치된 배치의 완료 순서 결과 시퀀스. 유한하고 재시작 불가.
 * - next()는 완료된 결과가 하나도 없을 때만 블록
 * - 소진 실패도 결과로 흘려보낸다(형제 작업은 취소하지 않음)
 * - close(): 미시작 작업 취소 → 풀 shutdown 후 바로 반환. 실행 중 작업은 끝까지 돌고 결과는 버려진다.
 *   마지막 작업이 끝나 풀이 종료되면 워커 스레드에서 세션을 반납한다({@link #awaitRelease}로 대기 가능).
 * 모든 결과를 꺼내면 자동으로 close된다.
 */
public final class FetchBatch implements ResultSource {

    private static final Logger LOG = LoggerFactory.getLogger(FetchBatch.class);

    private final ExecutorService exec;
    private final CompletionService<FetchResult<String>> completions;
    private final List<Future<FetchResult<String>>> futures;
    private final CountDownLatch released;
    private final FetchStats stats;
    private final int total;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private int taken = 0;

    /** released는 풀 종료 훅이 세션을 모두 닫은 뒤 내려간다. */
    FetchBatch(ExecutorService exec,
               CompletionService<FetchResult<String>> completions,
               List<Future<FetchResult<String>>> futures,
               CountDownLatch released,
               FetchStats stats,
               int total) {
        this.exec = exec;
        this.completions = completions;
        this.futures = futures;
        this.released = released;
        this.stats = stats;
        this.total = total;
    }

    public int size() { return total; }

    public boolean isClosed() { return closed.get(); }

    @Override public FetchStats.Snapshot stats() { return stats.snapshot(); }

    @Override
    public boolean hasNext() {
        return !closed.get() && taken < total;
    }

    @Override
    public FetchResult<String> next() {
        if (!hasNext()) throw new NoSuchElementException();

        Future<FetchResult<String>> f;
        try {
            f = completions.take();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            close();
            throw new CancellationException("Interrupted while waiting for next result");
        }
        taken++;

        try {
            FetchResult<String> r = f.get();
            if (taken == total) close();
            return r;
        } catch (ExecutionException e) {
            close();
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new FetchException("Fetch task failed: " + cause, cause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            close();
            throw new CancellationException("Interrupted while collecting result");
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        int abandoned = 0;
        for (Future<FetchResult<String>> f : futures) {
            if (!f.isDone()) {
                f.cancel(false); // 대기 중이면 실행 안 됨, 실행 중이면 끝까지 돌고 결과만 버려짐
                abandoned++;
            }
        }
        if (abandoned > 0) {
            LOG.info("Batch abandoned with {} unfinished fetch(es) of {}", abandoned, total);
        }
        // 기다리지 않는다. 실행 중 작업이 끝나면 풀 종료 훅이 세션을 닫는다.
        exec.shutdown();
        LOG.debug("Batch closed: {}", stats.snapshot());
    }

    /** 실행 중이던 작업이 끝나고 세션까지 반납될 때까지 대기. 시간 안에 끝나면 true. */
    @Override
    public boolean awaitRelease(long timeout, TimeUnit unit) throws InterruptedException {
        return released.await(timeout, unit);
    }

    public boolean isReleased() { return released.getCount() == 0; }

    /** 같은 인스턴스가 여러 번 들어 있어도 한 번씩만 닫는다. */
    static void closeSessions(List<? extends IFetchSession> sessions) {
        Set<IFetchSession> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        distinct.addAll(sessions);
        List<RuntimeException> errors = new ArrayList<>();
        for (IFetchSession s : distinct) {
            try {
                s.close();
            } catch (RuntimeException e) {
                errors.add(e);
            }
        }
        if (!errors.isEmpty()) {
            LOG.warn("{} session(s) failed to close cleanly; first: {}", errors.size(), errors.get(0).toString());
        }
    }
}
