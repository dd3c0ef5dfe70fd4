package com.pagefetch.core.model;

import com.pagefetch.core.exception.MaxAttemptsExceededException;

import java.util.Objects;
import java.util.function.Function;

/**
 * 요청 한 건의 최종 결과: 성공(payload) 또는 소진 실패(error) 중 하나.
 * payload는 원문 본문(String)이거나 필터링된 문서.
 */
public final class FetchResult<T> {
    private final FetchRequest request;
    private final T value;
    private final MaxAttemptsExceededException error;
    private final int attempts;
    private final int statusCode;

    private FetchResult(FetchRequest request, T value, MaxAttemptsExceededException error, int attempts, int statusCode) {
        this.request = Objects.requireNonNull(request, "request");
        this.value = value;
        this.error = error;
        this.attempts = attempts;
        this.statusCode = statusCode;
    }

    public static <T> FetchResult<T> success(FetchRequest request, T value, int attempts, int statusCode) {
        return new FetchResult<>(request, Objects.requireNonNull(value, "value"), null, attempts, statusCode);
    }

    public static <T> FetchResult<T> failure(FetchRequest request, MaxAttemptsExceededException error) {
        Objects.requireNonNull(error, "error");
        return new FetchResult<>(request, null, error, error.getAttempts(), error.getStatusCode());
    }

    public boolean isSuccess() { return error == null; }
    public FetchRequest getRequest() { return request; }
    public int getAttempts() { return attempts; }
    public int getStatusCode() { return statusCode; }

    /** 실패 결과면 null */
    public T getValue() { return value; }

    /** 성공 결과면 null */
    public MaxAttemptsExceededException getError() { return error; }

    /** 성공이면 값, 실패면 보존된 MaxAttemptsExceededException을 던진다. */
    public T getOrThrow() {
        if (error != null) throw error;
        return value;
    }

    /** 성공 payload만 변환. 실패는 그대로 전달. */
    public <R> FetchResult<R> map(Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn");
        if (error != null) return new FetchResult<>(request, null, error, attempts, statusCode);
        return new FetchResult<>(request, Objects.requireNonNull(fn.apply(value), "mapped value"), null, attempts, statusCode);
    }

    @Override public String toString() {
        return isSuccess()
                ? "FetchResult{ok, " + request.getUrl() + ", attempts=" + attempts + ", status=" + statusCode + '}'
                : "FetchResult{failed, " + request.getUrl() + ", " + error.getMessage() + '}';
    }
}
