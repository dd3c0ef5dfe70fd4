package com.pagefetch.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 입력 형태를 경계에서 한 번만 판정한 태그형 값: SINGLE(url) 또는 BATCH(urls).
 * 원소 1개짜리 컬렉션은 SINGLE로 정규화된다(풀 생성 회피).
 */
public final class FetchTarget {

    public enum Shape { SINGLE, BATCH }

    private final Shape shape;
    private final List<String> urls;

    private FetchTarget(Shape shape, List<String> urls) {
        this.shape = shape;
        this.urls = urls;
    }

    public static FetchTarget single(String url) {
        return new FetchTarget(Shape.SINGLE, List.of(requireUrl(url)));
    }

    /** 빈 컬렉션/빈 URL은 네트워크 호출 전에 거부 */
    public static FetchTarget of(Collection<String> urls) {
        Objects.requireNonNull(urls, "urls");
        if (urls.isEmpty()) throw new IllegalArgumentException("urls must not be empty");
        List<String> copy = new ArrayList<>(urls.size());
        for (String u : urls) copy.add(requireUrl(u));
        if (copy.size() == 1) return new FetchTarget(Shape.SINGLE, List.of(copy.get(0)));
        return new FetchTarget(Shape.BATCH, Collections.unmodifiableList(copy));
    }

    public Shape shape() { return shape; }
    public boolean isSingle() { return shape == Shape.SINGLE; }
    public List<String> urls() { return urls; }
    public int size() { return urls.size(); }

    /** SINGLE일 때만 의미 있음 */
    public String url() { return urls.get(0); }

    private static String requireUrl(String url) {
        Objects.requireNonNull(url, "url");
        if (url.isBlank()) throw new IllegalArgumentException("url must not be blank");
        return url;
    }

    @Override public String toString() {
        return shape + (isSingle() ? "(" + url() + ")" : "(" + urls.size() + " urls)");
    }
}
