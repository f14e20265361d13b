package com.ureca.fanout.changelog.service;

import com.ureca.fanout.subscription.dispatcher.DispatchOutcome;
import com.ureca.fanout.subscription.dispatcher.EventDispatchResult;

import java.util.List;

/**
 * 변경 로그 배치 한 건의 처리 결과
 */
public record BatchProcessingResult(
        int totalRecords,
        int skippedRecords, // INSERT 아님 + 해석 실패
        List<EventDispatchResult> events
) {

    public int dispatchedRecords() {
        return events.size();
    }

    public long count(DispatchOutcome outcome) {
        return events.stream()
                .mapToLong(event -> event.count(outcome))
                .sum();
    }
}
