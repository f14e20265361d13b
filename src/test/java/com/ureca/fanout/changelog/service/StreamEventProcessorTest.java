package com.ureca.fanout.changelog.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.fanout.changelog.dto.ChangeLogBatchContext;
import com.ureca.fanout.changelog.entity.ChangeRecord;
import com.ureca.fanout.subscription.delivery.ConnectionDelivery;
import com.ureca.fanout.subscription.delivery.ConnectionGoneException;
import com.ureca.fanout.subscription.delivery.OutboundMessage;
import com.ureca.fanout.subscription.dispatcher.DispatchOutcome;
import com.ureca.fanout.subscription.dispatcher.EventDispatchResult;
import com.ureca.fanout.subscription.dispatcher.SubscriberDispatcher;
import com.ureca.fanout.subscription.entity.Subscriber;
import com.ureca.fanout.subscription.registry.SubscriberRegistry;
import com.ureca.fanout.support.FakeOperationExecutor;
import com.ureca.fanout.support.fixture.ChangeRecordFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.ureca.fanout.support.fixture.SubscriberFixture.NOTE_ADDED;
import static com.ureca.fanout.support.fixture.SubscriberFixture.noteAdded;
import static com.ureca.fanout.support.fixture.SubscriberFixture.pages;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * StreamEventProcessor 테스트
 * 해석기와 팬아웃은 실제 객체, 구독자 저장소와 전송만 Mock
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("StreamEventProcessor 테스트")
class StreamEventProcessorTest {

    @Mock
    private SubscriberRegistry subscriberRegistry;

    @Mock
    private ConnectionDelivery connectionDelivery;

    private FakeOperationExecutor operationExecutor;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService dispatchExecutor;
    private StreamEventProcessor processor;
    private ChangeLogBatchContext batchContext;

    @BeforeEach
    void setUp() {
        operationExecutor = new FakeOperationExecutor(NOTE_ADDED);
        meterRegistry = new SimpleMeterRegistry();
        dispatchExecutor = Executors.newFixedThreadPool(4);

        SubscriberDispatcher dispatcher = new SubscriberDispatcher(
                subscriberRegistry,
                operationExecutor,
                connectionDelivery,
                (connection, context) -> Map.of(),
                new ObjectMapper(),
                dispatchExecutor,
                meterRegistry,
                50
        );
        processor = new StreamEventProcessor(
                new ChangeRecordDecoder(new AttributeValueConverter(), "event", "payload"),
                dispatcher,
                meterRegistry
        );
        batchContext = ChangeLogBatchContext.of("fanout.change-log.queue", 1);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatchExecutor.shutdownNow();
        dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("정상 : INSERT 레코드 -> 구독자에게 next 메시지 전송")
    void process_Insert_Delivers() {
        // given
        Subscriber subscriber = noteAdded("c-1");
        given(subscriberRegistry.findByEventName(eq(NOTE_ADDED), any(Pageable.class)))
                .willAnswer(pages(List.of(subscriber)));

        // when
        BatchProcessingResult result = processor.process(
                List.of(ChangeRecordFixture.insert(NOTE_ADDED, "{\"id\":1}")), batchContext);

        // then
        ArgumentCaptor<OutboundMessage> message = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(connectionDelivery).sendToConnection(eq(subscriber.connection()), message.capture());
        assertThat(message.getValue().type()).isEqualTo("next");

        assertThat(result.totalRecords()).isEqualTo(1);
        assertThat(result.dispatchedRecords()).isEqualTo(1);
        assertThat(result.count(DispatchOutcome.DELIVERED)).isEqualTo(1);
        assertThat(recordCount("dispatched")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("MODIFY, REMOVE 만 있는 배치 -> 저장소 조회와 전송 없이 완료")
    void process_NonInsert_NoSideEffects() {
        // given
        List<ChangeRecord> records = List.of(
                ChangeRecordFixture.modify(NOTE_ADDED, "{\"id\":1}"),
                ChangeRecordFixture.remove(NOTE_ADDED, "{\"id\":1}")
        );

        // when
        BatchProcessingResult result = processor.process(records, batchContext);

        // then
        verifyNoInteractions(subscriberRegistry, connectionDelivery);
        assertThat(operationExecutor.getRequests()).isEmpty();
        assertThat(result.skippedRecords()).isEqualTo(2);
        assertThat(result.dispatchedRecords()).isZero();
        assertThat(recordCount("skipped")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("해석 실패 레코드는 건너뛰고 다음 레코드 계속 처리")
    void process_DecodeFailure_Skipped() {
        // given
        Subscriber subscriber = noteAdded("c-1");
        given(subscriberRegistry.findByEventName(eq(NOTE_ADDED), any(Pageable.class)))
                .willAnswer(pages(List.of(subscriber)));

        List<ChangeRecord> records = List.of(
                ChangeRecordFixture.insertWithoutImage(),
                ChangeRecordFixture.insertWithImage(Map.of("event", ChangeRecordFixture.attribute("X", "?"))),
                ChangeRecordFixture.insert(NOTE_ADDED, "{\"id\":2}")
        );

        // when
        BatchProcessingResult result = processor.process(records, batchContext);

        // then
        assertThat(result.skippedRecords()).isEqualTo(2);
        assertThat(result.dispatchedRecords()).isEqualTo(1);
        verify(connectionDelivery).sendToConnection(eq(subscriber.connection()), any());
    }

    @Test
    @DisplayName("끊긴 연결로 전송 실패해도 배치는 정상 완료")
    void process_ConnectionGone_Completes() {
        // given
        Subscriber subscriber = noteAdded("c-gone");
        given(subscriberRegistry.findByEventName(eq(NOTE_ADDED), any(Pageable.class)))
                .willAnswer(pages(List.of(subscriber)));
        willThrow(new ConnectionGoneException("c-gone"))
                .given(connectionDelivery).sendToConnection(any(), any());

        // when
        BatchProcessingResult result = processor.process(
                List.of(ChangeRecordFixture.insert(NOTE_ADDED, "{\"id\":1}")), batchContext);

        // then
        assertThat(result.count(DispatchOutcome.FAILED)).isEqualTo(1);
        assertThat(meterRegistry.counter("fanout_deliveries_total", "result", "failed").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("같은 배치 재전달 -> 중복 제거 없이 다시 전송")
    void process_Redelivery_DeliversAgain() {
        // given
        Subscriber subscriber = noteAdded("c-1");
        given(subscriberRegistry.findByEventName(eq(NOTE_ADDED), any(Pageable.class)))
                .willAnswer(pages(List.of(subscriber)));
        List<ChangeRecord> records = List.of(ChangeRecordFixture.insert(NOTE_ADDED, "{\"id\":1}"));

        // when
        processor.process(records, batchContext);
        processor.process(records, batchContext);

        // then
        verify(connectionDelivery, times(2)).sendToConnection(eq(subscriber.connection()), any());
    }

    @Test
    @DisplayName("레코드 순서대로 이벤트 팬아웃")
    void process_KeepsRecordOrder() {
        // given
        given(subscriberRegistry.findByEventName(anyString(), any(Pageable.class)))
                .willAnswer(pages(List.of()));
        List<ChangeRecord> records = List.of(
                ChangeRecordFixture.insert("FIRST", "{}"),
                ChangeRecordFixture.insert("SECOND", "{}"),
                ChangeRecordFixture.insert("THIRD", "{}")
        );

        // when
        BatchProcessingResult result = processor.process(records, batchContext);

        // then
        assertThat(result.events())
                .extracting(EventDispatchResult::eventName)
                .containsExactly("FIRST", "SECOND", "THIRD");
    }

    @Test
    @DisplayName("예외 : 구독자 저장소 장애 -> 예외 전파 (배치 재전달)")
    void process_RegistryFailure_Propagates() {
        // given
        given(subscriberRegistry.findByEventName(eq(NOTE_ADDED), any(Pageable.class)))
                .willThrow(new IllegalStateException("저장소 연결 실패"));

        // when, then
        assertThatThrownBy(() -> processor.process(
                List.of(ChangeRecordFixture.insert(NOTE_ADDED, "{\"id\":1}")), batchContext))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("저장소 연결 실패");
        verify(connectionDelivery, never()).sendToConnection(any(), any());
    }

    private double recordCount(String result) {
        return meterRegistry.counter(StreamEventProcessor.RECORD_METRIC, "result", result).count();
    }
}
