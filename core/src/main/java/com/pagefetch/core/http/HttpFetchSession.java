package com.pagefetch.core.http;

import com.pagefetch.core.api.IFetchSession;
import com.pagefetch.core.model.FetchConfig;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 공유 HttpClient 위의 가벼운 세션 뷰.
 * HttpClient는 스레드 세이프이고 JDK 17에서는 닫을 수 없으므로, 서비스마다 하나만 만들고
 * (셀렉터 스레드 1개 + keep-alive 커넥션 풀) 요청/배치별 세션은 그 위에서 열고 닫는다.
 * close()는 이 뷰만 막는다. 클라이언트와 커넥션 풀은 소유 서비스와 수명을 같이한다.
 */
public final class HttpFetchSession implements IFetchSession {

    private final HttpClient client;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HttpFetchSession(HttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /** 설정(리다이렉트, 연결 타임아웃)을 반영한 클라이언트 */
    public static HttpClient newClient(FetchConfig config) {
        Objects.requireNonNull(config, "config");
        return HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
    }

    /** 클라이언트 하나를 만들고, 호출마다 그 위의 새 세션을 돌려주는 팩토리 */
    public static Supplier<HttpFetchSession> factory(FetchConfig config) {
        HttpClient shared = newClient(config);
        return () -> new HttpFetchSession(shared);
    }

    @Override
    public HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException {
        if (closed.get()) throw new IllegalStateException("session closed");
        return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() { return closed.get(); }

    HttpClient client() { return client; }
}
