package com.ureca.fanout.subscription.dispatcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.fanout.changelog.dto.ChangeLogBatchContext;
import com.ureca.fanout.subscription.delivery.ConnectionDelivery;
import com.ureca.fanout.subscription.delivery.OutboundMessage;
import com.ureca.fanout.subscription.entity.Subscriber;
import com.ureca.fanout.subscription.entity.SubscriptionEvent;
import com.ureca.fanout.subscription.execution.ExecutionContextProvider;
import com.ureca.fanout.subscription.execution.ExecutionMode;
import com.ureca.fanout.subscription.execution.ExecutionOutcome;
import com.ureca.fanout.subscription.execution.ExecutionRequest;
import com.ureca.fanout.subscription.execution.ExecutionResult;
import com.ureca.fanout.subscription.execution.ExecutionValueException;
import com.ureca.fanout.subscription.execution.OperationExecutor;
import com.ureca.fanout.subscription.execution.SingleEventSource;
import com.ureca.fanout.subscription.protocol.GraphQLProtocol;
import com.ureca.fanout.subscription.protocol.ProtocolSelector;
import com.ureca.fanout.subscription.registry.SubscriberRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 이벤트 한 건을 구독자들에게 팬아웃
 * <p>
 * 1. 구독자를 페이지 단위로 조회 (페이지는 순차 처리)
 * 2. 한 페이지 안의 구독자는 동시에 처리하고 전부 끝날 때까지 대기
 * 3. 구독자마다 새 SingleEventSource 로 연산을 실행하고 첫 값 하나만 꺼내 전송
 * <p>
 * 구독자 단위 실패는 모두 잡아서 결과 값으로 바꾼다.
 * 여기서 예외가 새면 변경 로그 배치 전체가 재전달되어 이미 받은 구독자에게 중복 전송된다
 */
@Slf4j
@RequiredArgsConstructor
public class SubscriberDispatcher {

    private static final String DELIVERY_METRIC = "fanout_deliveries_total";

    private final SubscriberRegistry subscriberRegistry;
    private final OperationExecutor operationExecutor;
    private final ConnectionDelivery connectionDelivery;
    private final ExecutionContextProvider executionContextProvider;
    private final ObjectMapper objectMapper;
    private final Executor dispatchExecutor;
    private final MeterRegistry meterRegistry;
    private final int pageSize;

    /**
     * 이벤트 팬아웃
     * 구독자 저장소 조회 장애는 그대로 전파한다 (배치 재전달이 올바른 복구)
     *
     * @param event        구독 이벤트
     * @param batchContext 호스트 호출 정보
     * @return 구독자별 처리 결과
     */
    public EventDispatchResult dispatch(SubscriptionEvent event, ChangeLogBatchContext batchContext) {
        List<SubscriberDispatchResult> results = new ArrayList<>();
        Pageable pageable = PageRequest.of(0, pageSize);
        int pageCount = 0;

        while (true) {
            Slice<Subscriber> page = subscriberRegistry.findByEventName(event.eventName(), pageable);
            pageCount++;

            log.debug("[Fanout] 구독자 페이지 조회. event: {}, page: {}, size: {}",
                    event.eventName(), pageable.getPageNumber(), page.getNumberOfElements());

            results.addAll(dispatchPage(event, page.getContent(), batchContext));

            if (!page.hasNext()) {
                break;
            }
            pageable = page.nextPageable();
        }

        EventDispatchResult result = new EventDispatchResult(event.eventName(), pageCount, results);

        log.info("[Fanout] 이벤트 팬아웃 완료. event: {}, 페이지: {}, 전송: {}, 필터: {}, 미시작: {}, 실패: {}",
                event.eventName(), pageCount,
                result.count(DispatchOutcome.DELIVERED),
                result.count(DispatchOutcome.FILTERED),
                result.count(DispatchOutcome.NOT_STARTED),
                result.count(DispatchOutcome.FAILED));

        return result;
    }

    // 페이지 내 구독자 동시 처리, 전부 끝나야 다음 페이지로 넘어간다
    private List<SubscriberDispatchResult> dispatchPage(
            SubscriptionEvent event,
            List<Subscriber> subscribers,
            ChangeLogBatchContext batchContext
    ) {
        List<CompletableFuture<SubscriberDispatchResult>> futures = new ArrayList<>(subscribers.size());

        for (Subscriber subscriber : subscribers) {
            futures.add(submit(event, subscriber, batchContext));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SubscriberDispatchResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<SubscriberDispatchResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private CompletableFuture<SubscriberDispatchResult> submit(
            SubscriptionEvent event,
            Subscriber subscriber,
            ChangeLogBatchContext batchContext
    ) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> dispatchToSubscriber(event, subscriber, batchContext),
                    dispatchExecutor
            );
        } catch (RejectedExecutionException e) {
            // Executor 종료 중이면 호출 스레드에서 직접 처리
            log.warn("[Fanout] Executor 거부. 호출 스레드에서 처리. operationId: {}", subscriber.operationId());
            return CompletableFuture.completedFuture(dispatchToSubscriber(event, subscriber, batchContext));
        }
    }

    /**
     * 구독자 한 명 처리
     * 어떤 경우에도 예외를 던지지 않고 결과를 반환한다
     */
    SubscriberDispatchResult dispatchToSubscriber(
            SubscriptionEvent event,
            Subscriber subscriber,
            ChangeLogBatchContext batchContext
    ) {
        SubscriberDispatchResult result;
        try {
            result = execute(event, subscriber, batchContext);
        } catch (Exception e) {
            log.error("[Fanout] 처리 중 예상치 못한 오류. operationId: {}, connectionId: {}",
                    subscriber.operationId(), connectionId(subscriber), e);
            result = SubscriberDispatchResult.failed(subscriber, FailureKind.UNEXPECTED, e);
        }

        Counter.builder(DELIVERY_METRIC)
                .tag("result", result.outcome().metricTag())
                .register(meterRegistry).increment();

        return result;
    }

    private SubscriberDispatchResult execute(
            SubscriptionEvent event,
            Subscriber subscriber,
            ChangeLogBatchContext batchContext
    ) {
        // 1. 실행 (DELIVER_ONLY: 구독 재등록 없음)
        ExecutionOutcome outcome;
        try {
            ExecutionRequest request = new ExecutionRequest(
                    subscriber.operation(),
                    subscriber.connection(),
                    new SingleEventSource(event, objectMapper),
                    ExecutionMode.DELIVER_ONLY,
                    executionContextProvider.provide(subscriber.connection(), batchContext),
                    batchContext
            );
            outcome = operationExecutor.execute(request);
        } catch (Exception e) {
            log.error("[Fanout] 구독 연산 실행 실패. operationId: {}, connectionId: {}",
                    subscriber.operationId(), connectionId(subscriber), e);
            return SubscriberDispatchResult.failed(subscriber, FailureKind.EXECUTION_START, e);
        }

        if (outcome == null || !outcome.isSubscribed()) {
            log.warn("[Fanout] 구독 연산 시작 안 됨. 전송 생략. operationId: {}, connectionId: {}, errors: {}",
                    subscriber.operationId(), connectionId(subscriber),
                    outcome == null || outcome.getErrorResult() == null ? null : outcome.getErrorResult().errors());
            return SubscriberDispatchResult.notStarted(subscriber);
        }

        // 2. 첫 값 하나만 수신
        ExecutionResult value;
        try {
            value = pullFirst(subscriber, outcome.getResults());
        } catch (ExecutionValueException e) {
            log.error("[Fanout] 구독 결과 수신 실패. operationId: {}, connectionId: {}",
                    subscriber.operationId(), connectionId(subscriber), e);
            return SubscriberDispatchResult.failed(subscriber, FailureKind.EXECUTION_VALUE, e);
        }

        if (value == null) {
            log.debug("[Fanout] 구독 필터에 걸림. 전송 생략. operationId: {}, event: {}",
                    subscriber.operationId(), event.eventName());
            return SubscriberDispatchResult.filtered(subscriber);
        }

        // 3. 프로토콜별 메시지 구성 후 전송
        GraphQLProtocol protocol = ProtocolSelector.forConnection(subscriber.connection());
        OutboundMessage message = new OutboundMessage(
                subscriber.operationId(),
                protocol.getServerEventTypes().data(),
                value
        );

        try {
            connectionDelivery.sendToConnection(subscriber.connection(), message);
        } catch (Exception e) {
            log.warn("[Fanout] 전송 실패. operationId: {}, connectionId: {}, error: {}",
                    subscriber.operationId(), connectionId(subscriber), e.getMessage(), e);
            return SubscriberDispatchResult.failed(subscriber, FailureKind.DELIVERY, e);
        }

        return SubscriberDispatchResult.delivered(subscriber);
    }

    // 첫 값 수신 후 스트림 취소, 값이 없으면 null
    private ExecutionResult pullFirst(Subscriber subscriber, Publisher<ExecutionResult> results) {
        try {
            return Mono.from(results).block();
        } catch (RuntimeException e) {
            throw new ExecutionValueException(subscriber.operationId(), e);
        }
    }

    private String connectionId(Subscriber subscriber) {
        return subscriber.connection() == null ? null : subscriber.connection().id();
    }
}
