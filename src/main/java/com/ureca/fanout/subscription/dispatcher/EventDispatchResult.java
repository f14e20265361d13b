package com.ureca.fanout.subscription.dispatcher;

import java.util.List;

/**
 * 이벤트 한 건의 팬아웃 결과
 */
public record EventDispatchResult(
        String eventName,
        int pageCount, // 조회한 구독자 페이지 수
        List<SubscriberDispatchResult> results
) {

    public long count(DispatchOutcome outcome) {
        return results.stream()
                .filter(result -> result.outcome() == outcome)
                .count();
    }
}
