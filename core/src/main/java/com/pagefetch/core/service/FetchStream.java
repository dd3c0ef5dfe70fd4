package com.pagefetch.core.service;

import com.pagefetch.core.exception.NetworkExhaustedException;
import com.pagefetch.core.model.FetchResult;
import com.pagefetch.core.model.FetchStats;
import com.pagefetch.core.parse.FilteringHtmlParser;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 필터링된 문서의 지연 시퀀스. 유한하고 재시작 불가.
 * - 첫 hasNext()/next() 호출 때 네트워크 작업을 시작한다
 * - 소진 실패를 만나면 배치를 닫고(대기 없이) 곧바로 NetworkExhaustedException으로 끝난다
 * - 중간에 그만둘 때는 close() (try-with-resources 권장)
 */
public final class FetchStream implements Iterator<Document>, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FetchStream.class);

    private final Supplier<ResultSource> opener;
    private final FilteringHtmlParser parser;
    private ResultSource source;
    private boolean closed;
    private int yielded;

    FetchStream(Supplier<ResultSource> opener, FilteringHtmlParser parser) {
        this.opener = opener;
        this.parser = parser;
    }

    @Override
    public boolean hasNext() {
        if (closed) return false;
        boolean more = source().hasNext();
        if (!more) close();
        return more;
    }

    @Override
    public Document next() {
        if (!hasNext()) throw new NoSuchElementException();

        FetchResult<String> raw;
        try {
            raw = source.next();
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        if (!raw.isSuccess()) {
            LOG.warn("Fetch exhausted after {} document(s): {}", yielded, raw.getError().getMessage());
            close();
            throw NetworkExhaustedException.from(raw.getError());
        }

        Document doc = parser.parse(raw.getValue(), raw.getRequest().getUrl().toString());
        yielded++;
        return doc;
    }

    /** 지금까지 넘겨준 문서 수 */
    public int yielded() { return yielded; }

    /** 아직 시작 전이면 빈 스냅샷 */
    public FetchStats.Snapshot stats() {
        return (source != null) ? source.stats() : new FetchStats().snapshot();
    }

    /** 닫힐 때 이 시퀀스도 닫히는 Stream 뷰 */
    public Stream<Document> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    public boolean isClosed() { return closed; }

    /**
     * close() 이후 실행 중이던 형제 요청이 끝나고 세션이 반납될 때까지 대기.
     * close()/예외 전파는 이 대기를 하지 않는다. 시작 전에 닫혔으면 바로 true.
     */
    public boolean awaitRelease(long timeout, TimeUnit unit) throws InterruptedException {
        return source == null || source.awaitRelease(timeout, unit);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (source != null) {
            source.close();
            LOG.info("Fetch stream closed: yielded={}, {}", yielded, source.stats());
        }
    }

    private ResultSource source() {
        if (source == null) {
            try {
                source = opener.get();
            } catch (RuntimeException e) {
                closed = true;
                throw e;
            }
        }
        return source;
    }
}
