package com.pagefetch.core.http;

import java.util.concurrent.ThreadLocalRandom;

/** 백오프 지연에 섞는 무작위 성분 */
public enum Jitter {
    /** 계산된 지연 그대로 */
    NONE {
        @Override long apply(long delayMs) { return delayMs; }
    },
    /** [0, d] 균등 분포 (동시 재시도 분산 효과가 가장 큼) */
    FULL {
        @Override long apply(long delayMs) {
            if (delayMs <= 0) return 0;
            // delayMs + 1 이 넘치지 않도록 상한에서는 [0, d) 로 뽑는다
            long bound = (delayMs == Long.MAX_VALUE) ? delayMs : delayMs + 1;
            return ThreadLocalRandom.current().nextLong(bound);
        }
    },
    /** [d/2, d] 균등 분포 */
    PARTIAL {
        @Override long apply(long delayMs) {
            if (delayMs <= 0) return 0;
            long half = delayMs / 2;
            return half + ThreadLocalRandom.current().nextLong(delayMs - half + 1);
        }
    };

    abstract long apply(long delayMs);
}
