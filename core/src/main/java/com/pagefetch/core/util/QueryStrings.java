package com.pagefetch.core.util;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 쿼리 문자열 조립 (Java 17)
 * - 같은 키의 다값은 key=a&amp;key=b 로 반복.
 * - 기존 쿼리가 있으면 뒤에 이어 붙인다(기존 항목은 건드리지 않음).
 */
public final class QueryStrings {
    private QueryStrings() {}

    public static URI withParams(URI base, Map<String, List<String>> params) {
        Objects.requireNonNull(base, "base");
        String q = encode(params);
        if (q.isEmpty()) return base;

        String s = base.toString();
        String fragment = "";
        int hash = s.indexOf('#');
        if (hash >= 0) {
            fragment = s.substring(hash);
            s = s.substring(0, hash);
        }
        String sep = (base.getRawQuery() == null) ? "?" : (s.endsWith("&") || s.endsWith("?") ? "" : "&");
        return URI.create(s + sep + q + fragment);
    }

    /** application/x-www-form-urlencoded 규칙으로 인코딩. 비어 있으면 "" */
    public static String encode(Map<String, List<String>> params) {
        if (params == null || params.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (var e : params.entrySet()) {
            String k = e.getKey();
            if (k == null) continue;
            List<String> vals = e.getValue();
            if (vals == null || vals.isEmpty()) continue;
            for (String v : vals) {
                if (sb.length() > 0) sb.append('&');
                sb.append(enc(k)).append('=').append(enc(v == null ? "" : v));
            }
        }
        return sb.toString();
    }

    private static String enc(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }
}
