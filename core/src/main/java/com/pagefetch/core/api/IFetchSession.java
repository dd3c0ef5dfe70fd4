package com.pagefetch.core.api;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * 연결 컨텍스트 최소 계약: 요청을 보내고 원문 바이트 응답을 돌려준다.
 * 테스트에서는 람다로 송신 훅을 주입한다.
 */
@FunctionalInterface
public interface IFetchSession extends AutoCloseable {
    HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException;

    /** 세션 단위 자원 반납. 여러 번 불려도 안전해야 한다. */
    @Override default void close() {}
}
