package com.pagefetch.core.model;

import com.pagefetch.core.util.ParamNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 요청별 쿼리 파라미터 지정.
 * - NONE: 지정 없음(기본 헤더 병합)
 * - SHARED: 맵 하나를 모든 URL에 적용 (빈 맵이면 기본 헤더 억제)
 * - POSITIONAL: i번째 맵을 i번째 URL에 적용
 * 원소 1개짜리 리스트는 SHARED로 풀린다.
 */
public final class FetchParams {

    private enum Kind { NONE, SHARED, POSITIONAL }

    private static final FetchParams NONE = new FetchParams(Kind.NONE, List.of());

    private final Kind kind;
    private final List<Map<String, Object>> maps;

    private FetchParams(Kind kind, List<Map<String, Object>> maps) {
        this.kind = kind;
        this.maps = maps;
    }

    public static FetchParams none() { return NONE; }

    public static FetchParams of(Map<String, ?> params) {
        Objects.requireNonNull(params, "params");
        return new FetchParams(Kind.SHARED, List.of(copy(params)));
    }

    public static FetchParams positional(List<? extends Map<String, ?>> list) {
        Objects.requireNonNull(list, "params");
        if (list.isEmpty()) throw new IllegalArgumentException("params list must not be empty");
        Object only = ParamNormalizer.unwrapSingleton(list);
        if (only instanceof Map<?, ?> m) {
            return new FetchParams(Kind.SHARED, List.of(copy(m)));
        }
        List<Map<String, Object>> out = new ArrayList<>(list.size());
        for (Map<String, ?> m : list) out.add(copy(Objects.requireNonNull(m, "params entry")));
        return new FetchParams(Kind.POSITIONAL, Collections.unmodifiableList(out));
    }

    /** 위치 지정 리스트 길이가 URL 수와 다르면 거부 */
    public void checkArity(int urlCount) {
        if (kind == Kind.POSITIONAL && maps.size() != urlCount) {
            throw new IllegalArgumentException(
                    "params list size " + maps.size() + " does not match url count " + urlCount);
        }
    }

    /** index번째 URL용 맵. NONE이면 null(= 지정 안 함). */
    public Map<String, Object> forIndex(int index) {
        return switch (kind) {
            case NONE -> null;
            case SHARED -> maps.get(0);
            case POSITIONAL -> maps.get(index);
        };
    }

    public boolean isPositional() { return kind == Kind.POSITIONAL; }

    private static Map<String, Object> copy(Map<?, ?> m) {
        Map<String, Object> out = new LinkedHashMap<>();
        m.forEach((k, v) -> out.put(String.valueOf(Objects.requireNonNull(k, "param key")), v));
        return Collections.unmodifiableMap(out);
    }

    @Override public String toString() {
        return "FetchParams{" + kind + (maps.isEmpty() ? "" : ", " + maps) + '}';
    }
}
