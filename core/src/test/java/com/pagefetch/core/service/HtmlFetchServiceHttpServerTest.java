package com.pagefetch.core.service;

import com.pagefetch.core.exception.NetworkExhaustedException;
import com.pagefetch.core.http.Jitter;
import com.pagefetch.core.model.FetchConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/** 실제 HttpClient 세션으로 로컬 HttpServer(임시 포트)를 호출하는 통합 테스트 */
class HtmlFetchServiceHttpServerTest {

    private HttpServer server;
    private ExecutorService serverPool;
    private String base;

    private final List<String> userAgents = new CopyOnWriteArrayList<>();
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final AtomicInteger flakyHits = new AtomicInteger();
    private final AtomicInteger downHits = new AtomicInteger();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        serverPool = Executors.newCachedThreadPool();
        server.setExecutor(serverPool);

        server.createContext("/list", ex -> {
            userAgents.add(String.valueOf(ex.getRequestHeaders().getFirst("User-Agent")));
            queries.add(String.valueOf(ex.getRequestURI().getRawQuery()));
            respond(ex, 200, "text/html; charset=utf-8", listing(ex.getRequestURI().getRawQuery()), StandardCharsets.UTF_8);
        });
        server.createContext("/flaky", ex -> {
            if (flakyHits.incrementAndGet() <= 2) {
                respond(ex, 503, "text/plain", "busy", StandardCharsets.UTF_8);
            } else {
                respond(ex, 200, "text/html", listing("recovered"), StandardCharsets.UTF_8);
            }
        });
        server.createContext("/down", ex -> {
            downHits.incrementAndGet();
            respond(ex, 500, "text/plain", "boom", StandardCharsets.UTF_8);
        });
        server.createContext("/slow", ex -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "text/html", listing("late"), StandardCharsets.UTF_8);
        });
        server.createContext("/kr", ex -> {
            String html = "<html><head><meta charset=\"euc-kr\"></head><body>"
                    + "<span class=\"totalcount\">매물 12건</span></body></html>";
            respond(ex, 200, "text/html", html, Charset.forName("EUC-KR"));
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
        serverPool.shutdownNow();
    }

    @Test
    void batch_over_real_http_yields_filtered_documents_with_default_user_agent() {
        HtmlFetchService svc = new HtmlFetchService(fastConfig());

        List<String> counts;
        try (FetchStream fs = svc.fetchMany(
                List.of(base + "/list", base + "/list", base + "/list"),
                List.of(Map.of("page", 1), Map.of("page", 2), Map.of("page", 3)))) {
            counts = fs.stream().map(d -> d.select("span.totalcount").text()).collect(Collectors.toList());
        }

        assertThat(counts).containsExactlyInAnyOrder("page=1", "page=2", "page=3");
        assertThat(queries).containsExactlyInAnyOrder("page=1", "page=2", "page=3");
        assertThat(userAgents).hasSize(3).allMatch("Mozilla/5.0"::equals);
    }

    @Test
    void transient_server_errors_are_retried_until_success() {
        HtmlFetchService svc = new HtmlFetchService(fastConfig());

        try (FetchStream fs = svc.fetchMany(base + "/flaky")) {
            Document doc = fs.next();
            assertThat(doc.select("span.totalcount").text()).isEqualTo("recovered");
            assertThat(fs.stats().retriesTotal).isEqualTo(2);
        }
        assertThat(flakyHits.get()).isEqualTo(3);
    }

    @Test
    void persistent_server_errors_exhaust_into_network_exhausted() {
        HtmlFetchService svc = new HtmlFetchService(fastConfig());

        try (FetchStream fs = svc.fetchMany(base + "/down")) {
            assertThatThrownBy(fs::next)
                    .isInstanceOf(NetworkExhaustedException.class)
                    .hasMessage(NetworkExhaustedException.MESSAGE);
        }
        assertThat(downHits.get()).isEqualTo(4);
    }

    @Test
    void per_attempt_timeout_counts_as_transient_failure() {
        FetchConfig cfg = fastConfig().setTimeoutMs(200);
        cfg.getRetry().setMaxAttempts(2);
        HtmlFetchService svc = new HtmlFetchService(cfg);

        try (FetchStream fs = svc.fetchMany(base + "/slow")) {
            assertThatThrownBy(fs::next)
                    .isInstanceOf(NetworkExhaustedException.class)
                    .hasRootCauseInstanceOf(HttpTimeoutException.class);
        }
    }

    @Test
    void meta_charset_is_honoured_when_header_has_none() {
        HtmlFetchService svc = new HtmlFetchService(fastConfig());

        try (FetchStream fs = svc.fetchMany(base + "/kr")) {
            assertThat(fs.next().select("span.totalcount").text()).isEqualTo("매물 12건");
        }
    }

    @Test
    void batches_on_one_service_share_a_single_http_client() throws Exception {
        long before = selectorThreads();
        HtmlFetchService svc = new HtmlFetchService(fastConfig());
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 10; i++) urls.add(base + "/list");

        for (int round = 0; round < 2; round++) {
            FetchStream fs = svc.fetchMany(urls);
            try (fs) {
                assertThat(fs.stream().count()).isEqualTo(10);
            }
            assertThat(fs.awaitRelease(5, TimeUnit.SECONDS)).isTrue();
            // 요청 수와 무관하게 셀렉터 스레드는 서비스당 하나
            assertThat(selectorThreads() - before).isLessThanOrEqualTo(1);
        }
        assertThat(queries).hasSize(20);
    }

    // ---- helpers ----
    private static long selectorThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .filter(t -> t.getName().endsWith("SelectorManager"))
                .count();
    }

    private static FetchConfig fastConfig() {
        FetchConfig cfg = FetchConfig.defaults();
        cfg.getRetry().setMaxAttempts(4).setBaseDelayMs(1).setJitter(Jitter.NONE).setMaxDelayMs(5);
        return cfg;
    }

    private static String listing(String marker) {
        return "<html><body><div class=\"nav\">menu</div>"
                + "<span class=\"totalcount\">" + marker + "</span>"
                + "<ul class=\"rows\"><li>row</li></ul></body></html>";
    }

    private static void respond(HttpExchange ex, int status, String contentType, String body, Charset cs)
            throws IOException {
        byte[] bytes = body.getBytes(cs);
        ex.getResponseHeaders().set("Content-Type", contentType);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }
}
