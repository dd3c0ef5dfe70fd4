package com.pagefetch.core.parse;

import org.jsoup.nodes.Attributes;
import org.jsoup.nodes.Element;

/** 파싱 중 요소 보존 여부를 결정하는 무상태 규칙. 여러 파싱에서 읽기 전용으로 공유된다. */
@FunctionalInterface
public interface DocumentFilter {
    boolean shouldRetain(String elementName, Attributes attributes);

    default boolean shouldRetain(Element el) {
        return shouldRetain(el.normalName(), el.attributes());
    }

    /** 전부 보존 (필터 미적용 파싱용) */
    DocumentFilter RETAIN_ALL = (name, attrs) -> true;
}
