package com.pagefetch.core.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FetchRequestTest {

    @Test
    void params_absent_means_defaults_are_merged() {
        FetchRequest r = FetchRequest.of("https://example.com/a");

        assertThat(r.isParamsSupplied()).isFalse();
        assertThat(r.getParams()).isEmpty();
        assertThat(r.suppressesDefaultHeaders()).isFalse();
    }

    @Test
    void explicitly_empty_params_suppress_defaults() {
        FetchRequest r = FetchRequest.of("https://example.com/a", Map.of());

        assertThat(r.isParamsSupplied()).isTrue();
        assertThat(r.suppressesDefaultHeaders()).isTrue();
    }

    @Test
    void params_are_normalized_to_multi_valued_in_input_order() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("q", "bike");
        raw.put("page", 2);
        raw.put("tags", List.of("red", "blue"));
        raw.put("single", List.of("one"));
        raw.put("skip", null);

        FetchRequest r = FetchRequest.of("https://example.com/search", raw);

        assertThat(r.getParams()).containsExactly(
                entry("q", List.of("bike")),
                entry("page", List.of("2")),
                entry("tags", List.of("red", "blue")),
                entry("single", List.of("one")));
        assertThat(r.suppressesDefaultHeaders()).isFalse();
    }

    @Test
    void non_http_or_blank_urls_are_rejected() {
        assertThatThrownBy(() -> FetchRequest.of("ftp://example.com/"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("http(s)");
        assertThatThrownBy(() -> FetchRequest.of("example.com/no-scheme"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FetchRequest.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FetchRequest.of("https://exa mple.com/"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unencoded_characters_are_encoded_instead_of_rejected() {
        FetchRequest r = FetchRequest.of("https://example.com/search results?q=road bike");

        assertThat(r.getUrl().getRawPath()).isEqualTo("/search%20results");
        assertThat(r.getUrl().getRawQuery()).isEqualTo("q=road%20bike");
        assertThat(r.getUrl().getQuery()).isEqualTo("q=road bike");
    }

    @Test
    void already_encoded_urls_are_kept_verbatim() {
        FetchRequest r = FetchRequest.of("https://example.com/s?q=road%20bike&x=%26");

        assertThat(r.getUrl().getRawQuery()).isEqualTo("q=road%20bike&x=%26");
    }

    @Test
    void builder_requires_url() {
        assertThatThrownBy(() -> FetchRequest.builder().build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void headers_are_immutable_copies() {
        FetchRequest r = FetchRequest.builder().url("https://example.com/").header("Accept", "text/html").build();

        assertThatThrownBy(() -> r.getHeaders().put("X", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
