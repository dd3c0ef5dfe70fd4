package com.pagefetch.core.http;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터 시작(방금 실패한 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(int statusCode, int attempt);
    /** attempt 실패 직후 다음 시도 전까지의 지연. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(마지막 성공 포함). 예: 3이면 최대 3번 시도. */
    int maxAttempts();
    /** 지연 상한. Retry-After 헤더 값도 이 값으로 잘린다. */
    default Duration maxDelay() { return Duration.ofSeconds(30); }

    /** 일시 실패로 볼 상태인지. 기본: 전송 예외(-1) 또는 429/5xx */
    default boolean isTransient(int statusCode) {
        return statusCode == -1 || statusCode == 429 || statusCode >= 500;
    }
}
