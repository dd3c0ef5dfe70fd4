package com.pagefetch.core.parse;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.parser.StreamParser;

import java.util.Iterator;
import java.util.Objects;

/**
 * jsoup StreamParser 기반 선택 파싱.
 * 요소가 닫히는 시점에:
 *  - 필터에 맞고 열린 조상 중 맞는 것이 없으면 → 하위 트리째 결과 문서로 이동
 *  - 맞지 않고 맞는 조상도 없으면 → 즉시 버림(메모리 해제)
 *  - 맞는 조상이 있으면 → 조상과 함께 이동하도록 그대로 둔다
 * 결과 문서의 자식은 최상위 보존 요소들이며 문서 순서를 따른다.
 */
public final class FilteringHtmlParser {

    private final DocumentFilter filter;

    public FilteringHtmlParser(DocumentFilter filter) {
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    public DocumentFilter filter() { return filter; }

    public Document parse(String html, String baseUri) {
        String base = (baseUri == null) ? "" : baseUri;
        Document out = new Document(base);
        if (html == null || html.isEmpty()) return out;

        try (StreamParser streamer = new StreamParser(Parser.htmlParser())) {
            streamer.parse(html, base);
            Iterator<Element> it = streamer.iterator();
            while (it.hasNext()) {
                Element el = it.next();
                if (el instanceof Document || el.parent() == null) continue;
                if (hasRetainedAncestor(el)) continue;

                if (filter.shouldRetain(el)) {
                    out.appendChild(el); // 원래 트리에서 떼어 결과로 이동
                } else {
                    el.remove();
                }
            }
        }
        return out;
    }

    private boolean hasRetainedAncestor(Element el) {
        for (Element p = el.parent(); p != null && !(p instanceof Document); p = p.parent()) {
            if (filter.shouldRetain(p)) return true;
        }
        return false;
    }
}
