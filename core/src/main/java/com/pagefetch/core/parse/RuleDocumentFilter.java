package com.pagefetch.core.parse;

import org.jsoup.nodes.Attributes;

import java.util.List;

/**
 * 규칙 테이블 기반 필터: 어느 규칙이든 맞으면 보존 (순서 무관).
 */
public final class RuleDocumentFilter implements DocumentFilter {

    // "search-attribute " 의 끝 공백은 실제 마크업 그대로다. 지우면 매칭이 깨진다.
    private static final RuleDocumentFilter LISTING_PAGE = new RuleDocumentFilter(List.of(
            FilterRule.of("section", "class", "userbody"),
            FilterRule.of("script", "type", "text/javascript"),
            FilterRule.of("div", "class", "search-attribute ", "search-attribute hide-list"),
            FilterRule.of("span", "class", "totalcount"),
            FilterRule.of("ul", "class", "rows")
    ));

    private final List<FilterRule> rules;

    public RuleDocumentFilter(List<FilterRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /** 검색 결과/상세 페이지에서 필요한 구역만 남기는 기본 테이블 (공유 인스턴스) */
    public static RuleDocumentFilter listingPage() {
        return LISTING_PAGE;
    }

    public List<FilterRule> rules() { return rules; }

    @Override
    public boolean shouldRetain(String elementName, Attributes attributes) {
        for (FilterRule r : rules) {
            if (r.matches(elementName, attributes)) return true;
        }
        return false;
    }
}
