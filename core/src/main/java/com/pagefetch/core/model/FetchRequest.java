package com.pagefetch.core.model;

import com.pagefetch.core.util.ParamNormalizer;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * GET 한 건의 불변 기술자.
 * params를 명시적으로 빈 맵으로 넘긴 경우(paramsSupplied && params 비어 있음)에만 기본 헤더를 섞지 않는다.
 */
public final class FetchRequest {
    private final URI url;
    private final Map<String, List<String>> params;
    private final boolean paramsSupplied;
    private final Map<String, String> headers;

    private FetchRequest(Builder b) {
        this.url = b.url;
        this.params = b.params;
        this.paramsSupplied = b.paramsSupplied;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
    }

    public URI getUrl() { return url; }
    public Map<String, List<String>> getParams() { return params; }
    public boolean isParamsSupplied() { return paramsSupplied; }
    public Map<String, String> getHeaders() { return headers; }

    /** 호출자가 빈 params를 명시 → 기본 헤더 병합 생략 */
    public boolean suppressesDefaultHeaders() {
        return paramsSupplied && params.isEmpty();
    }

    public static FetchRequest of(String url) {
        return builder().url(url).build();
    }

    public static FetchRequest of(String url, Map<String, ?> params) {
        return builder().url(url).params(params).build();
    }

    @Override public String toString() {
        return "FetchRequest{" + url + (params.isEmpty() ? "" : ", params=" + params) + '}';
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private Map<String, List<String>> params = Map.of();
        private boolean paramsSupplied;
        private final Map<String, String> headers = new LinkedHashMap<>();

        /** 잘못된 URL은 네트워크 호출 전에 IllegalArgumentException */
        public Builder url(String url) {
            Objects.requireNonNull(url, "url");
            if (url.isBlank()) throw new IllegalArgumentException("url must not be blank");
            URI u = parse(url.trim());
            String scheme = u.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException("url must be http(s): " + url);
            }
            this.url = u;
            return this;
        }

        /**
         * 인코딩된 URL은 그대로, 공백 등 미인코딩 문자가 섞인 URL은 구성요소별로 다시 인코딩한다.
         * 이미 %XX 로 인코딩된 부분과 미인코딩 문자가 한 URL에 섞여 있으면 %XX 가 한 번 더 인코딩된다.
         */
        private static URI parse(String url) {
            try {
                return URI.create(url);
            } catch (IllegalArgumentException strict) {
                try {
                    URL parsed = new URL(url);
                    return new URI(parsed.getProtocol(), parsed.getUserInfo(), parsed.getHost(), parsed.getPort(),
                            parsed.getPath(), parsed.getQuery(), parsed.getRef());
                } catch (MalformedURLException | URISyntaxException e) {
                    IllegalArgumentException iae = new IllegalArgumentException("malformed url: " + url, e);
                    iae.addSuppressed(strict);
                    throw iae;
                }
            }
        }

        /** null이면 "지정 안 함", 빈 맵이면 "명시적으로 비움" */
        public Builder params(Map<String, ?> params) {
            if (params == null) {
                this.params = Map.of();
                this.paramsSupplied = false;
            } else {
                this.params = ParamNormalizer.toMultiValued(params);
                this.paramsSupplied = true;
            }
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> hs) {
            if (hs != null) hs.forEach(this::header);
            return this;
        }

        public FetchRequest build() {
            Objects.requireNonNull(url, "url");
            return new FetchRequest(this);
        }
    }
}
