package com.pagefetch.core.service;

import com.pagefetch.core.model.FetchResult;
import com.pagefetch.core.model.FetchStats;

import java.util.Iterator;
import java.util.concurrent.TimeUnit;

/** FetchStream이 당겨 쓰는 원문 결과 공급원 (단건/배치 공통). */
interface ResultSource extends Iterator<FetchResult<String>>, AutoCloseable {

    FetchStats.Snapshot stats();

    @Override void close();

    /** close 이후 세션 반납까지 대기 */
    boolean awaitRelease(long timeout, TimeUnit unit) throws InterruptedException;
}
