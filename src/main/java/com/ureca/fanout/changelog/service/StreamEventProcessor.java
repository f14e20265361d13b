package com.ureca.fanout.changelog.service;

import com.ureca.fanout.changelog.dto.ChangeLogBatchContext;
import com.ureca.fanout.changelog.entity.ChangeRecord;
import com.ureca.fanout.subscription.dispatcher.DispatchOutcome;
import com.ureca.fanout.subscription.dispatcher.EventDispatchResult;
import com.ureca.fanout.subscription.dispatcher.SubscriberDispatcher;
import com.ureca.fanout.subscription.entity.SubscriptionEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 변경 로그 배치 처리 진입점
 * <p>
 * 레코드를 전달받은 순서대로 하나씩 해석하고, 이벤트마다 팬아웃을 끝낸 뒤 다음 레코드로 넘어간다
 * 파이프라인 내부 실패로는 절대 예외를 던지지 않는다 (던지면 호스트가 배치 전체를 재전달)
 * 구독자 저장소 조회 장애만 예외로 전파된다
 * 중복 제거는 하지 않는다 (at-least-once)
 */
@Slf4j
@RequiredArgsConstructor
public class StreamEventProcessor {

    public static final String RECORD_METRIC = "fanout_change_records_total";

    private final ChangeRecordDecoder changeRecordDecoder;
    private final SubscriberDispatcher subscriberDispatcher;
    private final MeterRegistry meterRegistry;

    public BatchProcessingResult process(List<ChangeRecord> records, ChangeLogBatchContext batchContext) {
        log.info("[ChangeLog] 배치 처리 시작. source: {}, 레코드 수: {}", batchContext.source(), records.size());

        List<EventDispatchResult> events = new ArrayList<>();
        int skipped = 0;

        for (ChangeRecord record : records) {
            Optional<SubscriptionEvent> event = decode(record);

            if (event.isEmpty()) {
                skipped++;
                countRecord("skipped");
                continue;
            }

            events.add(subscriberDispatcher.dispatch(event.get(), batchContext));
            countRecord("dispatched");
        }

        BatchProcessingResult result = new BatchProcessingResult(records.size(), skipped, events);

        log.info("[ChangeLog] 배치 처리 완료. 전체: {}, 건너뜀: {}, 팬아웃: {}, 전송: {}, 실패: {}",
                result.totalRecords(), result.skippedRecords(), result.dispatchedRecords(),
                result.count(DispatchOutcome.DELIVERED), result.count(DispatchOutcome.FAILED));

        return result;
    }

    // 해석 실패는 건너뜀으로 처리 (재전달해도 결과가 같으므로)
    private Optional<SubscriptionEvent> decode(ChangeRecord record) {
        try {
            return changeRecordDecoder.decode(record);
        } catch (Exception e) {
            log.warn("[ChangeLog] 레코드 해석 실패. 건너뜀. recordId: {}, error: {}",
                    record.recordId(), e.getMessage());
            return Optional.empty();
        }
    }

    private void countRecord(String result) {
        Counter.builder(RECORD_METRIC)
                .tag("result", result)
                .register(meterRegistry).increment();
    }
}
