package com.pagefetch.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 쿼리 파라미터 정규화.
 * - 원소 1개짜리 컬렉션은 스칼라로 풀어서 단건 호출과 배치(1건) 호출이 같은 값을 보게 한다.
 * - 값 타입(String/Number/Boolean/Collection)을 다값 맵(Map&lt;String, List&lt;String&gt;&gt;)으로 통일.
 */
public final class ParamNormalizer {
    private ParamNormalizer() {}

    /** 원소 1개짜리 컬렉션이면 그 원소, 아니면 그대로 */
    public static Object unwrapSingleton(Object value) {
        if (value instanceof Collection<?> c && c.size() == 1) {
            return c.iterator().next();
        }
        return value;
    }

    /**
     * raw 맵을 입력 순서 그대로 다값 맵으로 변환.
     * null 값 키는 버린다(보내지 않음). 빈 컬렉션도 마찬가지.
     */
    public static Map<String, List<String>> toMultiValued(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) return Map.of();
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (var e : raw.entrySet()) {
            String key = Objects.requireNonNull(e.getKey(), "param key");
            Object v = unwrapSingleton(e.getValue());
            if (v == null) continue;

            List<String> vals = new ArrayList<>();
            if (v instanceof Collection<?> c) {
                for (Object item : c) {
                    if (item != null) vals.add(String.valueOf(item));
                }
            } else {
                vals.add(String.valueOf(v));
            }
            if (!vals.isEmpty()) out.put(key, Collections.unmodifiableList(vals));
        }
        return Collections.unmodifiableMap(out);
    }
}
