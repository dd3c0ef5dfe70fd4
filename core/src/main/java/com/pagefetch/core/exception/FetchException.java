package com.pagefetch.core.exception;

import java.util.Map;

/**
 * 컴포넌트 경계를 넘는 페치 실패의 공통 상위 예외.
 */
public class FetchException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public FetchException(String message) {
        this(message, 0, null, Map.of());
    }

    public FetchException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public FetchException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    /** 마지막 HTTP 상태 코드. 전송 예외면 -1, 모르면 0. */
    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
