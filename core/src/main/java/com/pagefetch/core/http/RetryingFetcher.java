package com.pagefetch.core.http;

import com.pagefetch.core.api.IFetchSession;
import com.pagefetch.core.exception.MaxAttemptsExceededException;
import com.pagefetch.core.model.FetchConfig;
import com.pagefetch.core.model.FetchRequest;
import com.pagefetch.core.model.FetchResult;
import com.pagefetch.core.util.QueryStrings;
import com.pagefetch.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 단건 GET + 재시도.
 * - 일시 실패(IOException/타임아웃, 정책상 transient 상태코드)는 정책의 maxAttempts까지 흡수
 * - 소진 시 MaxAttemptsExceededException (마지막 일시 오류를 cause로 보존)
 * - Retry-After(초) 헤더가 있으면 계산된 지연보다 우선, 정책 maxDelay로 상한
 */
public final class RetryingFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingFetcher.class);

    private final Duration timeout;
    private final Map<String, String> defaultHeaders;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryingFetcher(FetchConfig config) {
        this(config, config.retryPolicy(), Sleeper.SYSTEM);
    }

    /** 정책/대기 훅 주입용 */
    public RetryingFetcher(FetchConfig config, RetryPolicy policy, Sleeper sleeper) {
        Objects.requireNonNull(config, "config");
        config.validate();
        this.timeout = config.getTimeout();
        this.defaultHeaders = Map.copyOf(config.getDefaultHeaders());
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public RetryPolicy policy() { return policy; }

    /** 본문 문자열 반환. 소진 시 MaxAttemptsExceededException. */
    public String fetch(IFetchSession session, FetchRequest request) throws InterruptedException {
        return attempt(session, request).getOrThrow();
    }

    /** 성공/소진을 결과 값으로 돌려주는 형태. 소진으로는 던지지 않는다. */
    public FetchResult<String> attempt(IFetchSession session, FetchRequest request) throws InterruptedException {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(request, "request");

        HttpRequest req = buildRequest(request);
        String url = req.uri().toString();
        int attempt = 1;
        while (true) {
            HttpResponse<byte[]> resp = null;
            IOException cause = null;
            int status;
            try {
                resp = session.send(req);
                status = resp.statusCode();
            } catch (IOException e) {
                cause = e;
                status = -1;
            }

            boolean transientFailure = (cause != null) || policy.isTransient(status);
            if (!transientFailure) {
                if (status < 200 || status >= 300) {
                    LOG.warn("Non-success status {} for {} (not retried)", status, url);
                }
                String body = CharsetResolver.decode(resp.body(), resp.headers().firstValue("Content-Type").orElse(null));
                LOG.debug("Fetched {} status={} attempts={} bytes={}", url, status, attempt,
                        resp.body() == null ? 0 : resp.body().length);
                return FetchResult.success(request, body, attempt, status);
            }

            if (attempt >= policy.maxAttempts() || !policy.shouldRetry(status, attempt)) {
                LOG.warn("Giving up on {} after {} attempt(s), lastStatus={}", url, attempt, status);
                return FetchResult.failure(request, new MaxAttemptsExceededException(url, attempt, status, cause));
            }

            Duration delay = resolveRetryAfterOr(policy.nextDelay(attempt), resp);
            if (cause != null) {
                LOG.debug("Attempt {} for {} failed: {}; retrying in {}ms", attempt, url, cause.toString(), delay.toMillis());
            } else {
                LOG.debug("Attempt {} for {} got status {}; retrying in {}ms", attempt, url, status, delay.toMillis());
            }
            sleeper.sleep(delay);
            attempt++;
        }
    }

    /** URL + 병합 쿼리 + 헤더(기본 헤더 위에 요청 헤더 덮어쓰기) */
    HttpRequest buildRequest(FetchRequest request) {
        URI uri = QueryStrings.withParams(request.getUrl(), request.getParams());

        Map<String, String> headers = new LinkedHashMap<>();
        if (!request.suppressesDefaultHeaders()) headers.putAll(defaultHeaders);
        headers.putAll(request.getHeaders());

        HttpRequest.Builder b = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET();
        headers.forEach(b::setHeader);
        return b.build();
    }

    /** Retry-After 헤더(초)를 존중하되 정책 maxDelay로 상한. HTTP-date 형식은 fallback 사용. */
    private Duration resolveRetryAfterOr(Duration fallback, HttpResponse<byte[]> resp) {
        if (resp == null) return fallback;
        List<String> values = resp.headers().allValues("Retry-After");
        if (values.isEmpty()) return fallback;
        try {
            long sec = Long.parseLong(values.get(0).trim());
            Duration d = Duration.ofSeconds(Math.max(0, sec));
            return d.compareTo(policy.maxDelay()) > 0 ? policy.maxDelay() : d;
        } catch (NumberFormatException httpDate) {
            return fallback;
        }
    }
}
