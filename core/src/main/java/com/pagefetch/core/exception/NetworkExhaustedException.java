package com.pagefetch.core.exception;

/**
 * 호출자에게 노출되는 {@link MaxAttemptsExceededException}. 스트림은 여기서 끝나지만
 * 이미 넘겨준 문서는 그대로 유효하다.
 */
public class NetworkExhaustedException extends FetchException {

    public static final String MESSAGE = "Maximum requests attempted - check network connection.";

    public NetworkExhaustedException(MaxAttemptsExceededException cause) {
        super(MESSAGE, cause.getStatusCode(), cause, cause.getContext());
    }

    public static NetworkExhaustedException from(MaxAttemptsExceededException cause) {
        return new NetworkExhaustedException(cause);
    }
}
