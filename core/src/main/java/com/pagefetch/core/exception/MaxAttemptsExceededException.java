package com.pagefetch.core.exception;

import java.util.Map;

/**
 * 재시도 정책이 허용한 시도를 모두 일시 실패로 소진했을 때 RetryingFetcher가 던진다.
 * 마지막 실패가 예외였다면 cause로 보존된다.
 */
public class MaxAttemptsExceededException extends FetchException {

    private final String url;
    private final int attempts;

    public MaxAttemptsExceededException(String url, int attempts, int lastStatus, Throwable lastCause) {
        super("Gave up on " + url + " after " + attempts + " attempt(s), last status " + lastStatus,
                lastStatus, lastCause, Map.of("url", url, "attempts", attempts));
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }
}
