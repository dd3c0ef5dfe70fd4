package com.pagefetch.core.service;

import com.pagefetch.core.api.IFetchSession;
import com.pagefetch.core.http.RetryingFetcher;
import com.pagefetch.core.model.FetchRequest;
import com.pagefetch.core.model.FetchResult;
import com.pagefetch.core.model.FetchStats;
import com.pagefetch.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 고정 크기 워커 풀로 요청을 팬아웃하고 완료 순서대로 결과를 모은다.
 * 슬롯 하나가 요청 하나의 재시도 전체를 처리한 뒤 다음 요청을 받는다.
 * 풀은 dispatchAll 호출마다 만들고 반환된 FetchBatch가 닫을 때 내린다.
 * 세션은 풀이 완전히 종료된 뒤(실행 중 작업까지 끝난 뒤) 종료 훅에서 반납된다.
 */
public final class WorkerPoolDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPoolDispatcher.class);

    public static final int DEFAULT_POOL_SIZE = 5;

    private final RetryingFetcher fetcher;
    private final int poolSize;

    public WorkerPoolDispatcher(RetryingFetcher fetcher) {
        this(fetcher, DEFAULT_POOL_SIZE);
    }

    public WorkerPoolDispatcher(RetryingFetcher fetcher, int poolSize) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1");
        this.poolSize = poolSize;
    }

    public int poolSize() { return poolSize; }

    /**
     * sessions[i]와 requests[i]를 짝지어 제출한다. 같은 세션 인스턴스를 반복해 넣어도 된다.
     * 길이가 다르거나 비어 있으면 네트워크 호출 전에 IllegalArgumentException.
     */
    public FetchBatch dispatchAll(List<? extends IFetchSession> sessions, List<FetchRequest> requests) {
        Objects.requireNonNull(sessions, "sessions");
        Objects.requireNonNull(requests, "requests");
        if (sessions.size() != requests.size()) {
            throw new IllegalArgumentException(
                    "sessions (" + sessions.size() + ") and requests (" + requests.size() + ") must align");
        }
        if (requests.isEmpty()) throw new IllegalArgumentException("requests must not be empty");
        for (int i = 0; i < requests.size(); i++) {
            Objects.requireNonNull(sessions.get(i), "sessions[" + i + "]");
            Objects.requireNonNull(requests.get(i), "requests[" + i + "]");
        }

        int cc = Math.max(1, Math.min(poolSize, requests.size()));
        List<IFetchSession> owned = List.copyOf(sessions);
        CountDownLatch released = new CountDownLatch(1);
        ExecutorService exec = new WorkerPool(cc, () -> {
            try {
                FetchBatch.closeSessions(owned);
            } finally {
                released.countDown();
            }
        });
        CompletionService<FetchResult<String>> completions = new ExecutorCompletionService<>(exec);
        FetchStats stats = new FetchStats();
        List<Future<FetchResult<String>>> futures = new ArrayList<>(requests.size());

        LOG.info("Dispatching {} request(s) on {} worker(s)", requests.size(), cc);
        FetchBatch batch = new FetchBatch(exec, completions, futures, released, stats, requests.size());
        try {
            for (int i = 0; i < requests.size(); i++) {
                IFetchSession session = sessions.get(i);
                FetchRequest request = requests.get(i);
                futures.add(completions.submit(() -> runOne(session, request, stats)));
            }
        } catch (RuntimeException e) {
            batch.close();
            throw e;
        }
        return batch;
    }

    /** 고정 크기 풀. 종료(shutdown 후 마지막 작업 완료) 시점에 onTerminated를 실행한다. */
    private static final class WorkerPool extends ThreadPoolExecutor {
        private final Runnable onTerminated;

        WorkerPool(int size, Runnable onTerminated) {
            super(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                    new NamedThreadFactory("fetch-worker"));
            this.onTerminated = onTerminated;
        }

        @Override
        protected void terminated() {
            try {
                onTerminated.run();
            } finally {
                super.terminated();
            }
        }
    }

    private FetchResult<String> runOne(IFetchSession session, FetchRequest request, FetchStats stats)
            throws InterruptedException {
        int cur = stats.enter();
        long t0 = System.nanoTime();
        LOG.debug("Fetch start {} (inFlight={})", request.getUrl(), cur);
        try {
            FetchResult<String> r = fetcher.attempt(session, request);
            stats.record(r, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
            return r;
        } finally {
            stats.exit();
        }
    }
}
