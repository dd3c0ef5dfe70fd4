package com.pagefetch.core.util;

import java.time.Duration;

/** 재시도 대기 훅. 테스트에서는 기록용 구현으로 교체한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** Thread.sleep 기반 기본 구현 (0 이하 지연은 즉시 반환) */
    Sleeper SYSTEM = d -> {
        long ms = Math.max(0, d.toMillis());
        if (ms > 0) Thread.sleep(ms);
    };
}
