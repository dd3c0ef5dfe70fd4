package com.pagefetch.core.service;

import com.pagefetch.core.api.IFetchSession;
import com.pagefetch.core.api.IHtmlFetcher;
import com.pagefetch.core.http.HttpFetchSession;
import com.pagefetch.core.http.RetryingFetcher;
import com.pagefetch.core.model.FetchConfig;
import com.pagefetch.core.model.FetchParams;
import com.pagefetch.core.model.FetchRequest;
import com.pagefetch.core.model.FetchResult;
import com.pagefetch.core.model.FetchStats;
import com.pagefetch.core.model.FetchTarget;
import com.pagefetch.core.parse.FilteringHtmlParser;
import com.pagefetch.core.parse.RuleDocumentFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 페치 오케스트레이터:
 *  - 입력 정규화(FetchTarget/FetchParams) → 단건이면 풀 없이 직접, 여러 건이면 WorkerPoolDispatcher
 *  - 원문 본문은 소비자 스레드에서 FilteringHtmlParser를 거쳐 Document가 된다
 *  - MaxAttemptsExceeded → NetworkExhausted 변환은 FetchStream이 담당
 * 잘못된 입력은 네트워크 호출 전에 이 메서드들에서 바로 실패한다.
 */
public final class HtmlFetchService implements IHtmlFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlFetchService.class);

    private final FetchConfig config;
    private final RetryingFetcher fetcher;
    private final Supplier<? extends IFetchSession> sessions;
    private final FilteringHtmlParser parser;

    /** 기본 구현. 서비스 인스턴스마다 HttpClient 하나를 만들어 모든 요청이 공유한다. */
    public HtmlFetchService() {
        this(FetchConfig.defaults());
    }

    public HtmlFetchService(FetchConfig config) {
        this(config, new RetryingFetcher(config), HttpFetchSession.factory(config),
                new FilteringHtmlParser(RuleDocumentFilter.listingPage()));
    }

    /** DI/테스트용 */
    public HtmlFetchService(FetchConfig config,
                            RetryingFetcher fetcher,
                            Supplier<? extends IFetchSession> sessions,
                            FilteringHtmlParser parser) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /* =========================
       실행 API
       ========================= */

    public FetchStream fetchMany(String url) {
        return fetchMany(FetchTarget.single(url), FetchParams.none());
    }

    public FetchStream fetchMany(String url, Map<String, ?> params) {
        return fetchMany(FetchTarget.single(url), FetchParams.of(params));
    }

    public FetchStream fetchMany(List<String> urls) {
        return fetchMany(FetchTarget.of(urls), FetchParams.none());
    }

    /** params[i]를 urls[i]에 적용. 원소 1개 리스트는 모든 URL에 공통 적용된다. */
    public FetchStream fetchMany(List<String> urls, List<? extends Map<String, ?>> params) {
        return fetchMany(FetchTarget.of(urls), FetchParams.positional(params));
    }

    @Override
    public FetchStream fetchMany(FetchTarget target, FetchParams params) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(params, "params");
        params.checkArity(target.size());
        List<FetchRequest> requests = buildRequests(target, params);

        if (target.isSingle()) {
            FetchRequest only = requests.get(0);
            return new FetchStream(() -> new SingleSource(fetcher, sessions, only), parser);
        }
        return new FetchStream(() -> dispatch(requests), parser);
    }

    /* =========================
       내부
       ========================= */

    private FetchBatch dispatch(List<FetchRequest> requests) {
        List<IFetchSession> paired = openSessions(requests.size());
        try {
            return new WorkerPoolDispatcher(fetcher, config.getPoolSize()).dispatchAll(paired, requests);
        } catch (RuntimeException e) {
            paired.forEach(IFetchSession::close);
            throw e;
        }
    }

    /** 기본은 요청당 세션 하나. shareSession=true면 같은 인스턴스를 n번 채운다. */
    private List<IFetchSession> openSessions(int n) {
        if (config.isShareSession()) {
            return Collections.nCopies(n, sessions.get());
        }
        List<IFetchSession> out = new ArrayList<>(n);
        try {
            for (int i = 0; i < n; i++) out.add(sessions.get());
        } catch (RuntimeException e) {
            out.forEach(IFetchSession::close);
            throw e;
        }
        return out;
    }

    private static List<FetchRequest> buildRequests(FetchTarget target, FetchParams params) {
        List<String> urls = target.urls();
        List<FetchRequest> out = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            out.add(FetchRequest.builder()
                    .url(urls.get(i))
                    .params(params.forIndex(i))
                    .build());
        }
        return out;
    }

    /** 단건 경로: 풀 없이 세션 하나로 한 번 가져오고 바로 세션을 반납한다. */
    private static final class SingleSource implements ResultSource {
        private final RetryingFetcher fetcher;
        private final Supplier<? extends IFetchSession> sessions;
        private final FetchRequest request;
        private final FetchStats stats = new FetchStats();
        private boolean consumed;

        SingleSource(RetryingFetcher fetcher, Supplier<? extends IFetchSession> sessions, FetchRequest request) {
            this.fetcher = fetcher;
            this.sessions = sessions;
            this.request = request;
        }

        @Override public boolean hasNext() { return !consumed; }

        @Override
        public FetchResult<String> next() {
            if (consumed) throw new NoSuchElementException();
            consumed = true;
            LOG.debug("Single fetch {}", request.getUrl());
            stats.enter();
            long t0 = System.nanoTime();
            try (IFetchSession session = sessions.get()) {
                FetchResult<String> r = fetcher.attempt(session, request);
                stats.record(r, (System.nanoTime() - t0) / 1_000_000);
                return r;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted during fetch of " + request.getUrl());
            } finally {
                stats.exit();
            }
        }

        @Override public FetchStats.Snapshot stats() { return stats.snapshot(); }

        @Override public void close() { consumed = true; }

        /** 세션은 next() 안에서 열고 닫으므로 기다릴 것이 없다. */
        @Override public boolean awaitRelease(long timeout, TimeUnit unit) { return true; }
    }
}
