package com.pagefetch.core.http;

import com.pagefetch.core.api.IFetchSession;
import com.pagefetch.core.exception.MaxAttemptsExceededException;
import com.pagefetch.core.model.FetchConfig;
import com.pagefetch.core.model.FetchRequest;
import com.pagefetch.core.model.FetchResult;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryingFetcherTest {

    private static final String OK_HTML = "<html><body><ul class=\"rows\"><li>a</li></ul></body></html>";

    private final FetchConfig cfg = FetchConfig.defaults();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final RetryPolicy policy =
            new DefaultRetryPolicy(5, Duration.ofMillis(100), 2.0, Jitter.NONE, Duration.ofMillis(1000));
    private final RetryingFetcher fetcher = new RetryingFetcher(cfg, policy, sleeper);

    @Test
    void succeeds_after_transient_failures_with_nondecreasing_bounded_delays() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        IFetchSession session = req -> {
            int n = calls.incrementAndGet();
            if (n == 1) throw new ConnectException("refused");
            if (n == 2) return StubResponse.of(503, "busy");
            if (n == 3) throw new HttpTimeoutException("slow");
            return StubResponse.ok(OK_HTML);
        };

        FetchResult<String> r = fetcher.attempt(session, FetchRequest.of("https://example.com/a"));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getValue()).isEqualTo(OK_HTML);
        assertThat(r.getAttempts()).isEqualTo(4);
        assertThat(calls.get()).isEqualTo(4);
        assertThat(sleeper.sleeps).containsExactly(
                Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
        for (int i = 1; i < sleeper.sleeps.size(); i++) {
            assertThat(sleeper.sleeps.get(i)).isGreaterThanOrEqualTo(sleeper.sleeps.get(i - 1));
        }
        assertThat(sleeper.sleeps).allSatisfy(d -> assertThat(d).isLessThanOrEqualTo(policy.maxDelay()));
    }

    @Test
    void exhaustion_returns_failure_carrying_attempts_and_last_cause() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        IFetchSession session = req -> {
            calls.incrementAndGet();
            throw new ConnectException("down");
        };

        FetchResult<String> r = fetcher.attempt(session, FetchRequest.of("https://example.com/down"));

        assertThat(r.isSuccess()).isFalse();
        assertThat(calls.get()).isEqualTo(5);
        assertThat(sleeper.sleeps).hasSize(4);
        MaxAttemptsExceededException e = r.getError();
        assertThat(e.getAttempts()).isEqualTo(5);
        assertThat(e.getStatusCode()).isEqualTo(-1);
        assertThat(e.getCause()).isInstanceOf(ConnectException.class);
        assertThat(e.getUrl()).isEqualTo("https://example.com/down");
    }

    @Test
    void fetch_throws_MaxAttemptsExceeded_on_exhaustion() {
        IFetchSession session = req -> StubResponse.of(429, "slow down");

        assertThatThrownBy(() -> fetcher.fetch(session, FetchRequest.of("https://example.com/x")))
                .isInstanceOf(MaxAttemptsExceededException.class)
                .hasMessageContaining("after 5 attempt(s)")
                .hasMessageContaining("last status 429");
    }

    @Test
    void non_transient_status_is_returned_without_retry() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        IFetchSession session = req -> {
            calls.incrementAndGet();
            return StubResponse.of(404, "<html><body>missing</body></html>");
        };

        FetchResult<String> r = fetcher.attempt(session, FetchRequest.of("https://example.com/missing"));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getStatusCode()).isEqualTo(404);
        assertThat(r.getValue()).contains("missing");
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void retry_after_seconds_overrides_backoff_and_is_capped() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        IFetchSession session = req -> {
            int n = calls.incrementAndGet();
            if (n == 1) return StubResponse.of(503, "").withHeader("Retry-After", "0");
            if (n == 2) return StubResponse.of(429, "").withHeader("Retry-After", "120");
            return StubResponse.ok(OK_HTML);
        };

        fetcher.fetch(session, FetchRequest.of("https://example.com/busy"));

        // 0초는 그대로, 120초는 maxDelay(1s)로 상한
        assertThat(sleeper.sleeps).containsExactly(Duration.ZERO, Duration.ofMillis(1000));
    }

    @Test
    void interrupted_send_propagates() {
        IFetchSession session = req -> { throw new InterruptedException("stop"); };

        assertThatThrownBy(() -> fetcher.attempt(session, FetchRequest.of("https://example.com/")))
                .isInstanceOf(InterruptedException.class);
    }

    @Test
    void default_user_agent_is_sent_when_params_not_supplied() throws Exception {
        List<HttpRequest> seen = new CopyOnWriteArrayList<>();
        IFetchSession session = req -> { seen.add(req); return StubResponse.ok(OK_HTML); };

        fetcher.fetch(session, FetchRequest.of("https://example.com/list"));

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).headers().firstValue("User-Agent")).contains("Mozilla/5.0");
        assertThat(seen.get(0).method()).isEqualTo("GET");
        assertThat(seen.get(0).timeout()).contains(Duration.ofSeconds(5));
    }

    @Test
    void explicitly_empty_params_suppress_default_headers() {
        HttpRequest req = fetcher.buildRequest(FetchRequest.of("https://example.com/list", Map.of()));

        assertThat(req.headers().firstValue("User-Agent")).isEmpty();
        assertThat(req.uri().toString()).isEqualTo("https://example.com/list");
    }

    @Test
    void params_are_encoded_into_query_and_defaults_still_merged() {
        HttpRequest req = fetcher.buildRequest(
                FetchRequest.of("https://example.com/search", Map.of("query", "road bike")));

        assertThat(req.uri().toString()).isEqualTo("https://example.com/search?query=road+bike");
        assertThat(req.headers().firstValue("User-Agent")).contains("Mozilla/5.0");
    }

    @Test
    void request_headers_override_config_defaults() {
        HttpRequest req = fetcher.buildRequest(FetchRequest.builder()
                .url("https://example.com/")
                .header("User-Agent", "custom/1.0")
                .header("Accept-Language", "en-US")
                .build());

        assertThat(req.headers().allValues("User-Agent")).containsExactly("custom/1.0");
        assertThat(req.headers().firstValue("Accept-Language")).contains("en-US");
    }

    @Test
    void default_headers_come_from_config_not_a_global() {
        FetchConfig custom = FetchConfig.defaults().setDefaultHeaders(Map.of("User-Agent", "pagefetch-test"));
        RetryingFetcher f = new RetryingFetcher(custom, policy, sleeper);

        HttpRequest req = f.buildRequest(FetchRequest.of("https://example.com/"));

        assertThat(req.headers().firstValue("User-Agent")).contains("pagefetch-test");
    }

    @Test
    void body_is_decoded_with_declared_charset() throws Exception {
        byte[] euc = "<html><body>안녕</body></html>".getBytes("EUC-KR");
        IFetchSession session = req -> StubResponse.of(200,
                Map.of("Content-Type", List.of("text/html; charset=EUC-KR")), euc);

        String body = fetcher.fetch(session, FetchRequest.of("https://example.com/kr"));

        assertThat(body).contains("안녕");
    }

    @Test
    void invalid_config_is_rejected_at_construction() {
        FetchConfig bad = FetchConfig.defaults();
        bad.getRetry().setMultiplier(1.0);

        assertThatThrownBy(() -> new RetryingFetcher(bad))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("multiplier");
    }
}
