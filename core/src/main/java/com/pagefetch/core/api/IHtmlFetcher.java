package com.pagefetch.core.api;

import com.pagefetch.core.model.FetchParams;
import com.pagefetch.core.model.FetchTarget;
import com.pagefetch.core.service.FetchStream;

/** URL 하나 또는 여러 개를 받아 필터링된 문서를 완료 순서대로 흘려준다. */
public interface IHtmlFetcher {
    FetchStream fetchMany(FetchTarget target, FetchParams params);

    default FetchStream fetchMany(FetchTarget target) {
        return fetchMany(target, FetchParams.none());
    }
}
